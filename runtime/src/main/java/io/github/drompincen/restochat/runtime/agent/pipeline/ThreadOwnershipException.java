package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.PipelineException;

/** A thread keeps the persona of its first turn; a caller with another persona is refused. */
public class ThreadOwnershipException extends PipelineException {

    public ThreadOwnershipException(String threadId, Persona owner, Persona caller) {
        super("this conversation belongs to another session type (thread " + threadId
                + " is " + owner.name().toLowerCase() + ", caller is " + caller.name().toLowerCase() + ")");
    }
}
