package domain.semantic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningResponseParserTest {

    private final ReasoningResponseParser parser = new ReasoningResponseParser();

    @Test
    void json_wrapped_in_prose_and_code_fence_is_extracted() {
        String response = """
                분석 결과입니다.
                ```json
                {"matches": [{"sourceColumn": "이름", "labelText": "성명", "labelRow": 1, "labelCol": 0, "confidence": 0.8}]}
                ```
                참고하세요.
                """;

        List<ReportedMatch> out = parser.parse(response);

        assertEquals(1, out.size());
        ReportedMatch m = out.get(0);
        assertEquals("이름", m.getSourceColumn());
        assertEquals("성명", m.getLabelText());
        assertEquals(1, m.getLabelRow());
        assertEquals(0, m.getLabelCol());
        assertEquals(0.8, m.getConfidence(), 1e-9);
        assertTrue(m.hasLabelPosition());
        assertFalse(m.hasDataPosition());
    }

    @Test
    void legacy_data_slots_with_alias_keys_and_string_numbers() {
        String response = "{\"dataSlots\": [{\"excelColumn\": \"핸드폰\", \"label\": \"연락처\", \"dataRow\": \"1\", \"dataCol\": 3}]}";

        List<ReportedMatch> out = parser.parse(response);

        assertEquals(1, out.size());
        assertEquals("핸드폰", out.get(0).getSourceColumn());
        assertEquals("연락처", out.get(0).getLabelText());
        assertEquals(1, out.get(0).getDataRow());
        assertEquals(3, out.get(0).getDataCol());
        assertNull(out.get(0).getConfidence());
    }

    @Test
    void malformed_or_missing_payload_gives_empty_list() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse("죄송합니다. 찾지 못했습니다.").isEmpty());
        assertTrue(parser.parse("{\"matches\": [1, 2,").isEmpty());
        assertTrue(parser.parse("{\"result\": []}").isEmpty());
    }

    @Test
    void non_object_items_are_skipped() {
        List<ReportedMatch> out = parser.parse("{\"matches\": [\"x\", {\"sourceColumn\": \"성명\"}]}");
        assertEquals(1, out.size());
        assertEquals("성명", out.get(0).getSourceColumn());
    }
}
