package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.runtime.agent.PipelineException;

public class StepLimitExceededException extends PipelineException {

    public StepLimitExceededException(int maxSteps, PipelineStage stage) {
        super("processing limit exceeded (" + maxSteps + " steps, last stage " + stage + ")");
    }
}
