package infra.output;

import domain.header.HierarchicalColumn;
import domain.mapping.FinalMapping;
import domain.mapping.MappingCandidate;
import domain.model.MappingWarning;
import domain.output.MappingReportWriter;
import domain.pipeline.PipelineResult;
import domain.validate.ValidationIssue;
import domain.validate.ValidationResult;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static infra.output.ReportRows.nullToEmpty;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>mappings: 최종 매핑 (source column → template 좌표, 신뢰도, 출처)</li>
 *   <li>issues: finalizer 가 버린 후보</li>
 *   <li>validation: 필수 필드 점검 요약 + 누락/제안 목록</li>
 *   <li>columns: 추론된 source 컬럼 (헤더 분석 결과가 있을 때 depth/원본 열 포함)</li>
 *   <li>warnings: 비치명적 경고 (표준 코드)</li>
 * </ul>
 */
public final class MappingReportXlsxWriter implements MappingReportWriter {

    private static void headerRow(Sheet sh, String... names) {
        Row header = sh.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    private static void writeMappingsSheet(Workbook wb, PipelineResult result) {
        Sheet sh = wb.createSheet("mappings");
        headerRow(sh, "sourceColumn", "targetRow", "targetCol", "labelText", "confidence", "origin", "reason");

        Map<FinalMapping, MappingCandidate> sources = ReportRows.candidatesByMapping(result);
        int r = 1;
        for (FinalMapping m : result.getMappings()) {
            MappingCandidate c = sources.get(m);
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(nullToEmpty(m.getSourceColumn()));
            row.createCell(1)
                    .setCellValue(m.getTargetRow());
            row.createCell(2)
                    .setCellValue(m.getTargetCol());
            row.createCell(3)
                    .setCellValue(c == null ? "" : nullToEmpty(c.getLabelText()));
            if (c != null) {
                row.createCell(4)
                        .setCellValue(c.getConfidence());
            }
            row.createCell(5)
                    .setCellValue(c == null ? "" : c.getOrigin()
                            .code());
            row.createCell(6)
                    .setCellValue(c == null ? "" : nullToEmpty(c.getReason()));
        }
    }

    private static void writeIssuesSheet(Workbook wb, List<MappingWarning> rejections) {
        Sheet sh = wb.createSheet("issues");
        headerRow(sh, "code", "sourceColumn", "message", "detail");

        int r = 1;
        for (MappingWarning w : rejections) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode() == null ? "" : w.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(w.getSourceColumn()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static void writeValidationSheet(Workbook wb, ValidationResult v) {
        Sheet sh = wb.createSheet("validation");
        int r = 0;

        Row summary = sh.createRow(r++);
        summary.createCell(0)
                .setCellValue("isValid");
        summary.createCell(1)
                .setCellValue(v.isValid());
        Row total = sh.createRow(r++);
        total.createCell(0)
                .setCellValue("totalRequiredFields");
        total.createCell(1)
                .setCellValue(v.getTotalRequiredFields());
        Row mapped = sh.createRow(r++);
        mapped.createCell(0)
                .setCellValue("mappedFields");
        mapped.createCell(1)
                .setCellValue(v.getMappedFields());
        Row missing = sh.createRow(r++);
        missing.createCell(0)
                .setCellValue("missingFields");
        missing.createCell(1)
                .setCellValue(v.getMissingFields());
        r++;

        Row header = sh.createRow(r++);
        String[] names = {"kind", "field", "message", "targetRow", "targetCol", "suggestedColumn"};
        for (int i = 0; i < names.length; i++) {
            header.createCell(i)
                    .setCellValue(names[i]);
        }

        for (ValidationIssue it : v.getIssues()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getKind() == null ? "" : it.getKind()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(it.getField()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(it.getMessage()));
            if (it.hasTarget()) {
                row.createCell(3)
                        .setCellValue(it.getTargetRow());
                row.createCell(4)
                        .setCellValue(it.getTargetCol());
            }
            row.createCell(5)
                    .setCellValue(it.hasSuggestion() ? it.getSuggestedColumn() : "");
        }
    }

    private static void writeColumnsSheet(Workbook wb, PipelineResult result) {
        Sheet sh = wb.createSheet("columns");
        headerRow(sh, "seq", "name", "sourceColIndex", "depth");

        int r = 1;
        if (result.getHeader() != null) {
            for (HierarchicalColumn c : result.getHeader().getColumns()) {
                Row row = sh.createRow(r);
                row.createCell(0)
                        .setCellValue(r);
                row.createCell(1)
                        .setCellValue(nullToEmpty(c.getName()));
                row.createCell(2)
                        .setCellValue(c.getSourceColIndex());
                row.createCell(3)
                        .setCellValue(c.getDepth());
                r++;
            }
            return;
        }
        for (String name : result.getColumns()) {
            Row row = sh.createRow(r);
            row.createCell(0)
                    .setCellValue(r);
            row.createCell(1)
                    .setCellValue(nullToEmpty(name));
            r++;
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<MappingWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        headerRow(sh, "code", "sourceColumn", "message", "detail");

        int r = 1;
        for (MappingWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode() == null ? "" : w.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(w.getSourceColumn()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    @Override
    public void write(Path out, PipelineResult result) {
        if (out == null) throw new IllegalArgumentException("out is null");
        if (result == null) throw new IllegalArgumentException("result is null");

        try {
            Path parent = out.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + out, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeMappingsSheet(wb, result);
            writeIssuesSheet(wb, result.getFinalized()
                    .getRejections());
            writeValidationSheet(wb, result.getValidation());
            writeColumnsSheet(wb, result);
            writeWarningsSheet(wb, result.getWarnings());

            try (OutputStream os = Files.newOutputStream(out)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + out, e);
        }
    }
}
