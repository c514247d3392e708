package io.github.drompincen.restochat.runtime.agent;

import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.pipeline.ConversationPipeline;
import io.github.drompincen.restochat.runtime.agent.pipeline.StepLimitExceededException;
import io.github.drompincen.restochat.runtime.agent.pipeline.ThreadOwnershipException;
import io.github.drompincen.restochat.runtime.lock.ThreadLockService;
import io.github.drompincen.restochat.runtime.logging.TurnLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Entry point for one user message. Serializes turns per thread and turns every failure into a
 * short apology, so callers never see an exception.
 */
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    public static final String APOLOGY_PREFIX = "Sorry, I encountered an error: ";

    private final ConversationPipeline pipeline;
    private final ThreadLockService lockService;
    private final Duration lockTimeout;

    public ChatService(ConversationPipeline pipeline, ThreadLockService lockService, Duration lockTimeout) {
        this.pipeline = pipeline;
        this.lockService = lockService;
        this.lockTimeout = lockTimeout;
    }

    public String processTurn(String text, String threadId, Persona persona) {
        if (persona == null) {
            log.warn("Turn rejected: no persona");
            return APOLOGY_PREFIX + "the session type is missing.";
        }
        String tid = resolveThreadId(threadId, persona);
        try (TurnLogContext ignored = TurnLogContext.open(tid, persona)) {
            if (text == null || text.isBlank()) {
                return APOLOGY_PREFIX + "the message was empty.";
            }
            if (!lockService.tryAcquire(tid, lockTimeout)) {
                return APOLOGY_PREFIX + "another message in this conversation is still being processed.";
            }
            try {
                log.info("Turn started ({} chars)", text.length());
                String reply = pipeline.run(text.trim(), tid, persona).reply();
                log.info("Turn finished ({} chars)", reply != null ? reply.length() : 0);
                return reply;
            } catch (StepLimitExceededException e) {
                log.error("Turn aborted: {}", e.getMessage());
                return APOLOGY_PREFIX + "processing limit exceeded.";
            } catch (ThreadOwnershipException e) {
                log.warn("Turn refused: {}", e.getMessage());
                return APOLOGY_PREFIX + e.getMessage();
            } catch (Exception e) {
                log.error("Turn failed", e);
                return APOLOGY_PREFIX + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                lockService.release(tid);
            }
        }
    }

    public static String resolveThreadId(String threadId, Persona persona) {
        return threadId == null || threadId.isBlank() ? persona.defaultThreadId() : threadId.trim();
    }

    /** Fresh isolated thread id, e.g. {@code customer_session:3f2a...}. */
    public static String newSessionId(Persona persona) {
        return persona.defaultThreadId() + ":" + UUID.randomUUID().toString().replace("-", "");
    }
}
