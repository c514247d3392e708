package io.github.drompincen.restochat.runtime.agent.llm;

import io.github.drompincen.restochat.runtime.agent.PipelineException;

public class ModelCallException extends PipelineException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
