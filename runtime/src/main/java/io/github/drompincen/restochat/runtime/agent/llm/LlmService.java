package io.github.drompincen.restochat.runtime.agent.llm;

public interface LlmService {

    /**
     * One request, one assistant message. Implementations may throw any runtime exception;
     * {@link TimedLlmCaller} turns it into a {@link ModelCallException}.
     */
    String blockingResponse(LlmRequest request);

    /**
     * Returns true if a working provider is configured.
     */
    default boolean isAvailable() { return true; }
}
