package io.github.drompincen.restochat.runtime.logging;

import io.github.drompincen.restochat.protocol.api.Persona;
import org.slf4j.MDC;

/**
 * Puts the thread id and persona of the running turn into the MDC so every log line of the
 * turn can be attributed. Use with try-with-resources.
 */
public final class TurnLogContext implements AutoCloseable {

    public static final String THREAD_ID = "threadId";
    public static final String PERSONA = "persona";

    private TurnLogContext(String threadId, Persona persona) {
        MDC.put(THREAD_ID, threadId);
        MDC.put(PERSONA, persona.name().toLowerCase());
    }

    public static TurnLogContext open(String threadId, Persona persona) {
        return new TurnLogContext(threadId, persona);
    }

    @Override
    public void close() {
        MDC.remove(THREAD_ID);
        MDC.remove(PERSONA);
    }
}
