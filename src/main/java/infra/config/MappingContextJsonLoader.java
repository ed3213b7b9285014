package infra.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.mapping.MappingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 매핑 context JSON → {@link MappingContext}.
 *
 * <pre>
 * {
 *   "description": "해외취업 연수생 이력카드",
 *   "fieldRelations": [ {"targetField": "참여기간", "sourceFields": ["시작일", "종료일"], "mergeStrategy": "concat"} ],
 *   "synonyms": { "수료여부": ["프로그램 이수 여부"] },
 *   "specialRules": [ {"condition": "...", "action": "..."} ]
 * }
 * </pre>
 */
public final class MappingContextJsonLoader {

    private static final Logger log = LoggerFactory.getLogger(MappingContextJsonLoader.class);

    private final ObjectMapper om;

    public MappingContextJsonLoader() {
        this(new ObjectMapper());
    }

    public MappingContextJsonLoader(ObjectMapper om) {
        this.om = om;
    }

    public MappingContext load(Path path) {
        if (path == null) return MappingContext.empty();
        try (InputStream is = Files.newInputStream(path)) {
            MappingContext ctx = load(is);
            log.info("[CONTEXT] loaded {} (relations={}, synonyms={}, rules={})", path,
                    ctx.getFieldRelations().size(), ctx.getSynonyms().size(), ctx.getSpecialRules().size());
            return ctx;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid context: " + path + " (" + e.getMessage() + ")", e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load context: " + path, e);
        }
    }

    public MappingContext load(InputStream is) throws IOException {
        JsonNode root = om.readTree(is);
        if (root == null || root.isNull() || root.isMissingNode()) return MappingContext.empty();
        if (!root.isObject()) throw new IllegalArgumentException("context root must be a JSON object");

        List<MappingContext.FieldRelation> relations = new ArrayList<>();
        for (JsonNode r : root.path("fieldRelations")) {
            relations.add(new MappingContext.FieldRelation(
                    r.path("targetField").asText(""),
                    strings(r.path("sourceFields")),
                    strategy(r.path("mergeStrategy").asText("")),
                    r.path("description").asText("")));
        }

        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        JsonNode syn = root.path("synonyms");
        if (syn.isObject()) {
            syn.fields().forEachRemaining(e -> synonyms.put(e.getKey(), strings(e.getValue())));
        }

        List<MappingContext.SpecialRule> rules = new ArrayList<>();
        for (JsonNode r : root.path("specialRules")) {
            rules.add(new MappingContext.SpecialRule(r.path("condition").asText(""), r.path("action").asText("")));
        }

        return new MappingContext(root.path("description").asText(""), relations, synonyms, rules);
    }

    private static MappingContext.MergeStrategy strategy(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return MappingContext.MergeStrategy.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown mergeStrategy: " + s, e);
        }
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>();
        if (arr == null || !arr.isArray()) return out;
        for (JsonNode v : arr) {
            String s = v.asText("");
            if (!s.isBlank()) out.add(s);
        }
        return out;
    }
}
