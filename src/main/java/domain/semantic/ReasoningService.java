package domain.semantic;

/**
 * 외부 추론 서비스 (LLM 등). 프롬프트 한 건 → 응답 텍스트 한 건.
 *
 * <p>구현은 자체 timeout 을 가져야 하며, 실패는 unchecked 예외로 알린다.</p>
 */
public interface ReasoningService {

    String complete(String prompt);
}
