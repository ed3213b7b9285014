package infra.output;

import domain.pipeline.PipelineResult;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MappingReportXlsxWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_all_report_sheets_under_nested_directory() throws Exception {
        PipelineResult result = ReportFixtures.result();
        Path out = tempDir.resolve("reports").resolve("applicants.mapping.xlsx");

        new MappingReportXlsxWriter().write(out, result);

        assertTrue(Files.exists(out), "expected file not found: " + out);
        try (InputStream in = Files.newInputStream(out); Workbook wb = WorkbookFactory.create(in)) {
            assertNotNull(wb.getSheet("mappings"));
            assertNotNull(wb.getSheet("issues"));
            assertNotNull(wb.getSheet("validation"));
            assertNotNull(wb.getSheet("columns"));
            assertNotNull(wb.getSheet("warnings"));

            Sheet mappings = wb.getSheet("mappings");
            assertEquals("sourceColumn", mappings.getRow(0).getCell(0).getStringCellValue());
            assertEquals(result.getMappings().size(), mappings.getLastRowNum());

            Row first = mappings.getRow(1);
            assertEquals(result.getMappings().get(0).getSourceColumn(), first.getCell(0).getStringCellValue());
            assertEquals("rule", first.getCell(5).getStringCellValue());

            Sheet validation = wb.getSheet("validation");
            assertFalse(validation.getRow(0).getCell(1).getBooleanCellValue());
            assertEquals(1.0, validation.getRow(3).getCell(1).getNumericCellValue(), 1e-9);

            Sheet columns = wb.getSheet("columns");
            assertEquals("이메일 주소", columns.getRow(4).getCell(1).getStringCellValue());
        }
    }

    @Test
    void should_reject_missing_arguments() {
        MappingReportXlsxWriter w = new MappingReportXlsxWriter();
        assertThrows(IllegalArgumentException.class, () -> w.write(null, ReportFixtures.result()));
        assertThrows(IllegalArgumentException.class, () -> w.write(tempDir.resolve("x.xlsx"), null));
    }
}
