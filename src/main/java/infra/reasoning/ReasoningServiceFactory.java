package infra.reasoning;

import dev.langchain4j.model.openai.OpenAiChatModel;
import domain.semantic.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** 설정 → 추론 서비스. key 가 없으면 empty (외부 matcher 는 skip 된다). */
public final class ReasoningServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(ReasoningServiceFactory.class);

    private ReasoningServiceFactory() {
    }

    public static Optional<ReasoningService> create(ReasoningConfig config) {
        if (config == null || config.getApiKey().isEmpty()) {
            log.info("[EXTERNAL] no API key configured, external matchers disabled");
            return Optional.empty();
        }

        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(config.getApiKey().get())
                .baseUrl(config.getBaseUrl())
                .modelName(config.getModelName())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxOutputTokens())
                .timeout(config.getTimeout())
                .maxRetries(0)
                .build();

        log.info("[EXTERNAL] reasoning service ready: {}", config);
        return Optional.of(new LangChainReasoningService(model));
    }
}
