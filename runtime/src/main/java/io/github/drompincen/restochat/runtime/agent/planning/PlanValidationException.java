package io.github.drompincen.restochat.runtime.agent.planning;

import io.github.drompincen.restochat.runtime.agent.PipelineException;

public class PlanValidationException extends PipelineException {

    public PlanValidationException(String message) {
        super(message);
    }
}
