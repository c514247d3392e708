package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.protocol.api.Intent;

/** Transition function of the turn state machine. */
@FunctionalInterface
public interface TurnTransitions {

    PipelineStage next(PipelineStage stage, TurnState state);

    static TurnTransitions standard() {
        return (stage, state) -> switch (stage) {
            case START -> PipelineStage.DETECT_INTENT;
            case DETECT_INTENT -> state.intent() == Intent.DB_QUERY ? PipelineStage.PLAN : PipelineStage.RESPOND;
            case PLAN -> {
                if (state.clarifyQuestion() != null) yield PipelineStage.CLARIFY;
                // a discarded plan falls back to a plain conversational reply
                yield state.plan() != null ? PipelineStage.EXEC : PipelineStage.RESPOND;
            }
            case CLARIFY -> PipelineStage.SUMMARIZE;
            case EXEC -> PipelineStage.RESPOND;
            case RESPOND -> PipelineStage.SUMMARIZE;
            case SUMMARIZE -> PipelineStage.END;
            case END -> throw new IllegalStateException("END is terminal");
        };
    }
}
