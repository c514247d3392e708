package io.github.drompincen.restochat.runtime.agent.respond;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.runtime.agent.llm.LlmPurpose;
import io.github.drompincen.restochat.runtime.agent.llm.LlmRequest;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Rolling conversation digest. Never fails a turn: on any error the previous summary stays. */
public class Summarizer {

    private static final Logger log = LoggerFactory.getLogger(Summarizer.class);

    static final String INSTRUCTIONS = """
            You maintain a concise running summary of a restaurant assistant conversation. \
            Merge the previous summary with the latest exchange, keep names, preferences and open \
            questions, and return only the updated summary in at most five sentences.""";

    private final TimedLlmCaller llm;

    public Summarizer(TimedLlmCaller llm) {
        this.llm = llm;
    }

    public String summarize(String previousSummary, String userMessage, String assistantMessage) {
        String exchange = "Previous summary:\n" + (previousSummary == null || previousSummary.isBlank() ? "(none)" : previousSummary)
                + "\n\nLatest exchange:\nUser: " + userMessage + "\nAssistant: " + assistantMessage;
        try {
            String updated = llm.call(new LlmRequest(LlmPurpose.SUMMARIZE,
                    List.of(ChatMessage.system(INSTRUCTIONS), ChatMessage.user(exchange)), 0.0));
            if (updated == null || updated.isBlank()) {
                return previousSummary;
            }
            return updated.trim();
        } catch (Exception e) {
            log.warn("Summary update failed, keeping previous summary: {}", e.getMessage());
            return previousSummary;
        }
    }
}
