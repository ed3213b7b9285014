package infra.reasoning;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import domain.semantic.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** langchain4j {@link ChatModel} 위의 단일 턴 completion. */
public final class LangChainReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(LangChainReasoningService.class);

    private final ChatModel chatModel;

    public LangChainReasoningService(ChatModel chatModel) {
        if (chatModel == null) throw new IllegalArgumentException("chatModel is null");
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String prompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt == null ? "" : prompt))
                .build();

        long started = System.currentTimeMillis();
        ChatResponse response = chatModel.chat(request);
        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null || message.text() == null ? "" : message.text();

        log.debug("[EXTERNAL] completion in {}ms, chars={}", System.currentTimeMillis() - started, text.length());
        return text;
    }
}
