package infra.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.header.HeaderHeuristics;
import domain.mapping.MatchingHeuristics;
import domain.mapping.OverrideRule;
import domain.profile.HeuristicProfile;
import domain.validate.RequiredField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * profile JSON → {@link HeuristicProfile}.
 *
 * <p>적힌 항목만 기본값 위에 덮어쓴다. 예:</p>
 * <pre>
 * {
 *   "name": "career-card",
 *   "header":   { "metaScanRows": 8, "shortLabel": {"min": 2, "max": 12} },
 *   "matching": { "confidenceFloor": 0.6,
 *                 "overrideRules": [ {"pattern": "2분기_취업처", "row": 19, "col": 6, "label": "2분기 취업처"} ] },
 *   "requiredFields": [ {"name": "성명", "aliases": ["이름"]} ]
 * }
 * </pre>
 * <p>{@code overrideRules} 는 기본 표를 통째로 바꾼다. 기본 표 뒤에 붙이려면 {@code appendOverrideRules: true}.</p>
 */
public final class HeuristicProfileJsonLoader {

    private static final Logger log = LoggerFactory.getLogger(HeuristicProfileJsonLoader.class);

    private final ObjectMapper om;

    public HeuristicProfileJsonLoader() {
        this(new ObjectMapper());
    }

    public HeuristicProfileJsonLoader(ObjectMapper om) {
        this.om = om;
    }

    public HeuristicProfile load(Path path) {
        if (path == null) return HeuristicProfile.defaults();
        try (InputStream is = Files.newInputStream(path)) {
            HeuristicProfile p = load(is);
            log.info("[PROFILE] loaded '{}' from {}", p.getName(), path);
            return p;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid profile: " + path + " (" + e.getMessage() + ")", e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load profile: " + path, e);
        }
    }

    public HeuristicProfile load(InputStream is) throws java.io.IOException {
        JsonNode root = om.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("profile root must be a JSON object");
        }

        String name = text(root, "name", "custom");
        HeaderHeuristics header = header(root.path("header"));
        MatchingHeuristics matching = matching(root.path("matching"));
        List<RequiredField> required = root.has("requiredFields")
                ? requiredFields(root.get("requiredFields"))
                : RequiredField.defaults();

        return new HeuristicProfile(name, header, matching, required);
    }

    private static HeaderHeuristics header(JsonNode n) {
        HeaderHeuristics d = HeaderHeuristics.defaults();
        if (!n.isObject()) return d;

        HeaderHeuristics.Builder b = d.toBuilder();
        if (n.has("metaScanRows")) b.metaScanRows(n.get("metaScanRows").asInt());
        if (n.has("headerScanRows")) b.headerScanRows(n.get("headerScanRows").asInt());
        if (n.has("minHeaderCells")) b.minHeaderCells(n.get("minHeaderCells").asInt());

        JsonNode sl = n.path("shortLabel");
        if (sl.isObject()) {
            b.shortLabelRange(sl.path("min").asInt(d.getShortLabelMin()), sl.path("max").asInt(d.getShortLabelMax()));
        }

        JsonNode w = n.path("weights");
        if (w.isObject()) {
            b.weights(
                    w.path("cell").asInt(d.getCellWeight()),
                    w.path("shortLabel").asInt(d.getShortLabelWeight()),
                    w.path("numberLabel").asInt(d.getNumberLabelBonus()),
                    w.path("nameLabel").asInt(d.getNameLabelBonus()),
                    w.path("metaPenalty").asInt(d.getMetaCellPenalty()));
        }

        JsonNode walk = n.path("walk");
        if (walk.isObject()) {
            b.walk(walk.path("upward").asInt(d.getUpwardRows()), walk.path("downward").asInt(d.getDownwardRows()));
        }

        if (n.has("subHeaderPatterns")) b.subHeaderPatterns(patterns(n.get("subHeaderPatterns")));
        if (n.has("basicColumnPatterns")) b.basicColumnPatterns(patterns(n.get("basicColumnPatterns")));
        if (n.has("compositeNoisePatterns")) b.compositeNoisePatterns(patterns(n.get("compositeNoisePatterns")));

        JsonNode fb = n.path("fallback");
        if (fb.isObject()) {
            b.fallbackScan(fb.path("scanRows").asInt(d.getFallbackScanRows()), fb.path("shortMax").asInt(d.getFallbackShortMax()));
        }
        return b.build();
    }

    private static MatchingHeuristics matching(JsonNode n) {
        MatchingHeuristics d = MatchingHeuristics.defaults();
        if (!n.isObject()) return d;

        MatchingHeuristics.Builder b = d.toBuilder();
        if (n.has("labelMinLength") || n.has("shortLabelMax")) {
            b.labelLength(n.path("labelMinLength").asInt(d.getLabelMinLength()), n.path("shortLabelMax").asInt(d.getShortLabelMax()));
        }
        if (n.has("titleLengthThreshold")) b.titleLengthThreshold(n.get("titleLengthThreshold").asInt());
        if (n.has("belowScanRows")) b.belowScanRows(n.get("belowScanRows").asInt());
        if (n.has("documentTitles")) b.documentTitles(new LinkedHashSet<>(strings(n.get("documentTitles"))));

        JsonNode c = n.path("confidence");
        if (c.isObject()) {
            b.confidences(
                    c.path("exact").asDouble(d.getExactConfidence()),
                    c.path("partial").asDouble(d.getPartialConfidence()),
                    c.path("override").asDouble(d.getOverrideConfidence()),
                    c.path("external").asDouble(d.getExternalDefaultConfidence()));
        }
        if (n.has("consensusStep")) b.consensusStep(n.get("consensusStep").asDouble());
        if (n.has("confidenceFloor")) b.confidenceFloor(n.get("confidenceFloor").asDouble());

        if (n.has("overrideRules")) {
            List<OverrideRule> rules = new ArrayList<>();
            if (n.path("appendOverrideRules").asBoolean(false)) rules.addAll(d.getOverrideRules());
            for (JsonNode r : n.get("overrideRules")) {
                String pattern = r.path("pattern").asText("");
                if (pattern.isBlank()) throw new IllegalArgumentException("overrideRules[].pattern is required");
                if (!r.has("row") || !r.has("col")) {
                    throw new IllegalArgumentException("overrideRules[] needs row and col: " + pattern);
                }
                rules.add(OverrideRule.of(pattern, r.get("row").asInt(), r.get("col").asInt(), r.path("label").asText(pattern)));
            }
            b.overrideRules(rules);
        }
        return b.build();
    }

    private static List<RequiredField> requiredFields(JsonNode arr) {
        List<RequiredField> out = new ArrayList<>();
        for (JsonNode f : arr) {
            String name = f.path("name").asText("");
            if (name.isBlank()) throw new IllegalArgumentException("requiredFields[].name is required");
            out.add(new RequiredField(name, strings(f.path("aliases"))));
        }
        return out;
    }

    private static List<Pattern> patterns(JsonNode arr) {
        List<Pattern> out = new ArrayList<>();
        for (String s : strings(arr)) {
            try {
                out.add(Pattern.compile(s));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("bad pattern: " + s, e);
            }
        }
        return out;
    }

    private static List<String> strings(JsonNode arr) {
        if (arr == null || !arr.isArray()) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode v : arr) {
            String s = v.asText("");
            if (!s.isBlank()) out.add(s);
        }
        return new ArrayList<>(out);
    }

    private static String text(JsonNode n, String field, String def) {
        String v = n.path(field).asText("");
        return v.isBlank() ? def : v;
    }
}
