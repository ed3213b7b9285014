package domain.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 추론 응답 텍스트에서 JSON 객체를 꺼내 매칭 목록으로 바꾼다.
 *
 * <p>응답은 설명 문장이나 코드 펜스로 감싸여 올 수 있다. 첫 '{' 부터 마지막 '}' 까지를 JSON 으로 본다.
 * "matches" 배열을 읽고, 없으면 예전 형식인 "dataSlots" 배열을 읽는다.</p>
 *
 * <p>형식이 깨졌으면 빈 목록.</p>
 */
public final class ReasoningResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ReasoningResponseParser.class);

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper;

    public ReasoningResponseParser() {
        this(new ObjectMapper());
    }

    public ReasoningResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ReportedMatch> parse(String response) {
        if (response == null || response.isBlank()) return List.of();

        Matcher m = JSON_OBJECT.matcher(response);
        if (!m.find()) {
            log.warn("[EXTERNAL] response has no JSON object");
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(m.group());
        } catch (Exception e) {
            log.warn("[EXTERNAL] malformed JSON response: {}", e.getMessage());
            return List.of();
        }

        JsonNode items = root.path("matches");
        if (!items.isArray()) items = root.path("dataSlots");
        if (!items.isArray()) {
            log.warn("[EXTERNAL] response has neither 'matches' nor 'dataSlots' array");
            return List.of();
        }

        List<ReportedMatch> out = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (!item.isObject()) continue;
            out.add(new ReportedMatch(
                    firstText(item, "sourceColumn", "excelColumn", "column"),
                    firstText(item, "labelText", "label"),
                    intOrNull(item, "labelRow"),
                    intOrNull(item, "labelCol"),
                    intOrNull(item, "dataRow"),
                    intOrNull(item, "dataCol"),
                    doubleOrNull(item, "confidence")
            ));
        }
        return out;
    }

    private static String firstText(JsonNode node, String... names) {
        for (String n : names) {
            JsonNode v = node.get(n);
            if (v != null && v.isValueNode() && !v.isNull()) {
                String s = v.asText().trim();
                if (!s.isEmpty()) return s;
            }
        }
        return null;
    }

    private static Integer intOrNull(JsonNode node, String name) {
        JsonNode v = node.get(name);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.asInt();
        if (v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double doubleOrNull(JsonNode node, String name) {
        JsonNode v = node.get(name);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual()) {
            try {
                return Double.parseDouble(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
