package infra.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.pipeline.PipelineResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonMappingReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_mappings_with_origin_and_validation_summary() throws Exception {
        PipelineResult result = ReportFixtures.result();
        Path out = tempDir.resolve("out").resolve("applicants.mapping.json");

        new JsonMappingReportWriter().write(out, result);

        assertTrue(Files.exists(out));
        JsonNode root = new ObjectMapper().readTree(out.toFile());

        JsonNode mappings = root.get("mappings");
        assertEquals(3, mappings.size());
        JsonNode name = null;
        for (JsonNode m : mappings) {
            if ("성명".equals(m.get("sourceColumn").asText())) name = m;
        }
        assertNotNull(name);
        assertEquals(1, name.get("targetRow").asInt());
        assertEquals(1, name.get("targetCol").asInt());
        assertEquals("rule", name.get("origin").asText());
        assertEquals(0.95, name.get("confidence").asDouble(), 1e-9);

        JsonNode validation = root.get("validation");
        assertFalse(validation.get("isValid").asBoolean());
        assertEquals(2, validation.get("totalRequiredFields").asInt());
        assertEquals(1, validation.get("missingFields").asInt());
        assertEquals("생년월일", validation.get("issues").get(0).get("field").asText());
        assertEquals(2, validation.get("issues").get(0).get("targetRow").asInt());
        assertEquals(3, validation.get("issues").get(0).get("targetCol").asInt());

        assertEquals(4, root.get("columns").size());
        assertEquals(0, root.get("columns").get(0).get("depth").asInt());
        assertTrue(root.get("issues").isArray());
        assertTrue(root.get("warnings").isArray());
    }

    @Test
    void should_report_plain_column_names_when_header_analysis_was_skipped() {
        JsonMappingReportWriter w = new JsonMappingReportWriter();
        PipelineResult withHeader = ReportFixtures.result();
        PipelineResult plain = new PipelineResult(
                null,
                withHeader.getColumns(),
                withHeader.getCandidates(),
                withHeader.getMergedCandidates(),
                withHeader.getFinalized(),
                withHeader.getValidation(),
                withHeader.getWarnings());

        JsonNode columns = w.toJson(plain).get("columns");

        assertEquals(4, columns.size());
        assertEquals("No", columns.get(0).get("name").asText());
        assertFalse(columns.get(0).has("depth"));
    }
}
