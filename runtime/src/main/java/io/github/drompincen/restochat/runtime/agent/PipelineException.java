package io.github.drompincen.restochat.runtime.agent;

/** Base type for every failure raised inside a turn. */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
