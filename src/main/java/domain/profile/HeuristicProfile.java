package domain.profile;

import domain.header.HeaderHeuristics;
import domain.mapping.MatchingHeuristics;
import domain.validate.RequiredField;

import java.util.List;

/**
 * 매핑 파이프라인의 튜닝 값 묶음.
 *
 * <p>양식이 바뀌면 코드 대신 profile 을 바꾼다 (infra.config.HeuristicProfileJsonLoader).</p>
 */
public final class HeuristicProfile {

    private final String name;
    private final HeaderHeuristics header;
    private final MatchingHeuristics matching;
    private final List<RequiredField> requiredFields;

    public HeuristicProfile(String name, HeaderHeuristics header, MatchingHeuristics matching, List<RequiredField> requiredFields) {
        this.name = name == null || name.isBlank() ? "default" : name;
        this.header = header == null ? HeaderHeuristics.defaults() : header;
        this.matching = matching == null ? MatchingHeuristics.defaults() : matching;
        this.requiredFields = requiredFields == null ? RequiredField.defaults() : List.copyOf(requiredFields);
    }

    public static HeuristicProfile defaults() {
        return new HeuristicProfile("default", HeaderHeuristics.defaults(), MatchingHeuristics.defaults(), RequiredField.defaults());
    }

    public String getName() {
        return name;
    }

    public HeaderHeuristics getHeader() {
        return header;
    }

    public MatchingHeuristics getMatching() {
        return matching;
    }

    public List<RequiredField> getRequiredFields() {
        return requiredFields;
    }
}
