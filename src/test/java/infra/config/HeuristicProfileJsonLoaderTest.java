package infra.config;

import domain.header.HeaderHeuristics;
import domain.mapping.MatchingHeuristics;
import domain.profile.HeuristicProfile;
import domain.validate.RequiredField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicProfileJsonLoaderTest {

    @TempDir
    Path tempDir;

    private final HeuristicProfileJsonLoader loader = new HeuristicProfileJsonLoader();

    private HeuristicProfile load(String json) throws Exception {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void only_present_keys_override_defaults() throws Exception {
        HeuristicProfile p = load("""
                {
                  "name": "hr-2024",
                  "header": { "minHeaderCells": 2, "walk": { "upward": 1 } },
                  "matching": { "confidenceFloor": 0.6, "belowScanRows": 3 }
                }
                """);

        HeaderHeuristics d = HeaderHeuristics.defaults();
        assertEquals("hr-2024", p.getName());
        assertEquals(2, p.getHeader().getMinHeaderCells());
        assertEquals(1, p.getHeader().getUpwardRows());
        assertEquals(d.getDownwardRows(), p.getHeader().getDownwardRows());
        assertEquals(d.getMetaScanRows(), p.getHeader().getMetaScanRows());

        assertEquals(0.6, p.getMatching().getConfidenceFloor(), 1e-9);
        assertEquals(3, p.getMatching().getBelowScanRows());
        assertEquals(MatchingHeuristics.defaults().getExactConfidence(), p.getMatching().getExactConfidence(), 1e-9);
        assertEquals(RequiredField.defaults().size(), p.getRequiredFields().size());
    }

    @Test
    void override_rules_replace_or_append() throws Exception {
        int defaults = MatchingHeuristics.defaults().getOverrideRules().size();

        HeuristicProfile replaced = load("""
                {"matching": {"overrideRules": [{"pattern": "^비고$", "row": 22, "col": 1, "label": "비고"}]}}
                """);
        assertEquals(1, replaced.getMatching().getOverrideRules().size());
        assertTrue(replaced.getMatching().getOverrideRules().get(0).matches("비고"));
        assertEquals(22, replaced.getMatching().getOverrideRules().get(0).getTargetRow());

        HeuristicProfile appended = load("""
                {"matching": {"appendOverrideRules": true, "overrideRules": [{"pattern": "^비고$", "row": 22, "col": 1}]}}
                """);
        assertEquals(defaults + 1, appended.getMatching().getOverrideRules().size());
    }

    @Test
    void required_fields_and_patterns_are_read() throws Exception {
        HeuristicProfile p = load("""
                {
                  "header": { "subHeaderPatterns": ["^\\\\d+차$"] },
                  "requiredFields": [ {"name": "성명", "aliases": ["이름", "Name"]}, {"name": "국가"} ]
                }
                """);

        assertEquals(1, p.getHeader().getSubHeaderPatterns().size());
        assertTrue(p.getHeader().getSubHeaderPatterns().get(0).matcher("2차").matches());
        assertEquals(List.of("성명", "이름", "Name"), p.getRequiredFields().get(0).allNames());
        assertTrue(p.getRequiredFields().get(1).getAliases().isEmpty());
    }

    @Test
    void invalid_content_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> load("[]"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"header\": {\"basicColumnPatterns\": [\"(unclosed\"]}}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"matching\": {\"overrideRules\": [{\"pattern\": \"x\"}]}}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"requiredFields\": [{\"aliases\": [\"a\"]}]}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"header\": {\"minHeaderCells\": 0}}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"matching\": {\"confidenceFloor\": 1.5}}"));
    }

    @Test
    void path_loading_wraps_errors_with_file_name() throws Exception {
        assertEquals("default", loader.load((Path) null).getName());

        Path bad = tempDir.resolve("bad.json");
        Files.writeString(bad, "{\"requiredFields\": [{}]}");
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> loader.load(bad));
        assertTrue(ex.getMessage().contains("bad.json"));

        assertThrows(RuntimeException.class, () -> loader.load(tempDir.resolve("missing.json")));
    }
}
