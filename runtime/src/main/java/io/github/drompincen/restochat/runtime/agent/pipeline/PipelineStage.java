package io.github.drompincen.restochat.runtime.agent.pipeline;

public enum PipelineStage {
    START,
    DETECT_INTENT,
    PLAN,
    CLARIFY,
    EXEC,
    RESPOND,
    SUMMARIZE,
    END
}
