package infra.reasoning;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * 외부 추론 서비스 연결 설정.
 *
 * <p>API key 가 없으면 서비스 자체를 만들지 않는다 ({@link ReasoningServiceFactory}).</p>
 */
public final class ReasoningConfig {

    public static final String ENV_API_KEY = "FIELDMAP_REASONING_API_KEY";
    public static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    public static final String ENV_BASE_URL = "FIELDMAP_REASONING_BASE_URL";
    public static final String ENV_MODEL = "FIELDMAP_REASONING_MODEL";
    public static final String ENV_TIMEOUT_MS = "FIELDMAP_REASONING_TIMEOUT_MS";

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai/";
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 4096;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Optional<String> apiKey;
    private final String baseUrl;
    private final String modelName;
    private final double temperature;
    private final int maxOutputTokens;
    private final Duration timeout;

    public ReasoningConfig(Optional<String> apiKey,
                           String baseUrl,
                           String modelName,
                           double temperature,
                           int maxOutputTokens,
                           Duration timeout) {
        this.apiKey = apiKey == null ? Optional.empty() : apiKey.filter(s -> !s.isBlank());
        this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : baseUrl.trim();
        this.modelName = isBlank(modelName) ? DEFAULT_MODEL : modelName.trim();
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens > 0 ? maxOutputTokens : DEFAULT_MAX_OUTPUT_TOKENS;
        this.timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? DEFAULT_TIMEOUT : timeout;
    }

    public static ReasoningConfig disabled() {
        return new ReasoningConfig(Optional.empty(), null, null, DEFAULT_TEMPERATURE, DEFAULT_MAX_OUTPUT_TOKENS, DEFAULT_TIMEOUT);
    }

    /**
     * 환경변수에서 읽는다. key 는 FIELDMAP_REASONING_API_KEY 가 우선, 없으면 GEMINI_API_KEY.
     */
    public static ReasoningConfig fromEnvironment(Map<String, String> env) {
        Map<String, String> e = env == null ? Map.of() : env;

        Optional<String> key = Optional.ofNullable(e.get(ENV_API_KEY)).filter(s -> !s.isBlank())
                .or(() -> Optional.ofNullable(e.get(ENV_GEMINI_API_KEY)).filter(s -> !s.isBlank()));

        Duration timeout = DEFAULT_TIMEOUT;
        String t = e.get(ENV_TIMEOUT_MS);
        if (!isBlank(t)) {
            try {
                timeout = Duration.ofMillis(Long.parseLong(t.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + ENV_TIMEOUT_MS + ": " + t, ex);
            }
        }

        return new ReasoningConfig(key, e.get(ENV_BASE_URL), e.get(ENV_MODEL),
                DEFAULT_TEMPERATURE, DEFAULT_MAX_OUTPUT_TOKENS, timeout);
    }

    public ReasoningConfig withTimeout(Duration timeout) {
        return new ReasoningConfig(apiKey, baseUrl, modelName, temperature, maxOutputTokens, timeout);
    }

    public Optional<String> getApiKey() {
        return apiKey;
    }

    public boolean isEnabled() {
        return apiKey.isPresent();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        // key 는 찍지 않는다
        return "ReasoningConfig{enabled=" + isEnabled()
                + ", baseUrl=" + baseUrl
                + ", model=" + modelName
                + ", timeout=" + timeout.toMillis() + "ms}";
    }
}
