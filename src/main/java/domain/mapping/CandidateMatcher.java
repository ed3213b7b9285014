package domain.mapping;

import java.util.List;

/**
 * 후보 생성기. 구현들은 서로 독립적이며 동시에 실행된다.
 *
 * <p>예외를 던지거나 시간 초과가 나면 파이프라인이 빈 목록으로 취급한다.</p>
 */
public interface CandidateMatcher {

    CandidateOrigin origin();

    /** 설정이 없어 아무것도 만들지 못하는 matcher 는 false. */
    default boolean isAvailable() {
        return true;
    }

    List<MappingCandidate> match(MatchRequest request);
}
