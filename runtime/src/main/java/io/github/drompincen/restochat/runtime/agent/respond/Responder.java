package io.github.drompincen.restochat.runtime.agent.respond;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.runtime.agent.llm.LlmPurpose;
import io.github.drompincen.restochat.runtime.agent.llm.LlmRequest;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the reply prompt in a fixed order: persona prompt, known profile, summary, history,
 * new user message, tool result, suggestion directive. The model output is returned as-is.
 */
public class Responder {

    static final String NO_SUGGESTIONS =
            "Do not add follow-up suggestions, next steps or 'you might also like' sections.";

    private final TimedLlmCaller llm;
    private final boolean suggestionsEnabled;

    public Responder(TimedLlmCaller llm, boolean suggestionsEnabled) {
        this.llm = llm;
        this.suggestionsEnabled = suggestionsEnabled;
    }

    public String respond(PersonaProfile profile, String memoryNote, String summary,
                          List<ChatMessage> history, String userMessage, String toolResult) {
        return llm.call(new LlmRequest(LlmPurpose.RESPOND,
                buildPrompt(profile, memoryNote, summary, history, userMessage, toolResult),
                profile.modelConfig().temperature()), profile.modelConfig().timeout());
    }

    List<ChatMessage> buildPrompt(PersonaProfile profile, String memoryNote, String summary,
                                  List<ChatMessage> history, String userMessage, String toolResult) {
        List<ChatMessage> prompt = new ArrayList<>(history.size() + 6);
        prompt.add(ChatMessage.system(profile.systemPrompt()));
        if (memoryNote != null && !memoryNote.isBlank()) {
            prompt.add(ChatMessage.system("Known profile:\n" + memoryNote));
        }
        if (summary != null && !summary.isBlank()) {
            prompt.add(ChatMessage.system("Conversation summary:\n" + summary));
        }
        prompt.addAll(history);
        prompt.add(ChatMessage.user(userMessage));
        if (toolResult != null) {
            prompt.add(ChatMessage.system("Tool result:\n" + toolResult));
        }
        if (!suggestionsEnabled) {
            prompt.add(ChatMessage.system(NO_SUGGESTIONS));
        }
        return prompt;
    }
}
