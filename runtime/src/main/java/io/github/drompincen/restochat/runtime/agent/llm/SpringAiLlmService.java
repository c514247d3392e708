package io.github.drompincen.restochat.runtime.agent.llm;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Model backend over the Spring AI {@link ChatModel} created by the OpenAI starter.
 * The key is read at call time so one set through a system property after startup is honored.
 */
@Service
@ConditionalOnProperty(name = "restochat.llm.provider", havingValue = "openai", matchIfMissing = true)
public class SpringAiLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmService.class);
    private static final String KEY_PROPERTY = "spring.ai.openai.api-key";
    private static final String PLACEHOLDER_PREFIX = "sk-placeholder";

    private final ChatModel chatModel;
    private final Environment environment;

    public SpringAiLlmService(@Autowired(required = false) ChatModel chatModel, Environment environment) {
        this.chatModel = chatModel;
        this.environment = environment;
        log.info("SpringAiLlmService initialized, chat model {}", chatModel != null ? "available" : "missing");
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null && hasRealKey(resolveKey());
    }

    @Override
    public String blockingResponse(LlmRequest request) {
        if (chatModel == null) {
            throw new ModelCallException("No chat model configured");
        }
        if (!hasRealKey(resolveKey())) {
            throw new ModelCallException("No OpenAI API key configured (set OPENAI_API_KEY)");
        }
        Prompt prompt = new Prompt(toMessages(request.messages()),
                ChatOptions.builder().temperature(request.temperature()).build());
        ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ModelCallException("Empty response from model");
        }
        return response.getResult().getOutput().getText();
    }

    static List<Message> toMessages(List<ChatMessage> messages) {
        List<Message> out = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            String content = m.content() != null ? m.content() : "";
            switch (m.role()) {
                case SYSTEM, TOOL -> out.add(new SystemMessage(content));
                case ASSISTANT -> out.add(new AssistantMessage(content));
                case USER -> out.add(new UserMessage(content));
            }
        }
        return out;
    }

    private String resolveKey() {
        String key = System.getProperty(KEY_PROPERTY);
        if (key != null && !key.isBlank()) return key;
        return environment.getProperty(KEY_PROPERTY, "");
    }

    private static boolean hasRealKey(String key) {
        return key != null && !key.isBlank() && !key.startsWith(PLACEHOLDER_PREFIX);
    }
}
