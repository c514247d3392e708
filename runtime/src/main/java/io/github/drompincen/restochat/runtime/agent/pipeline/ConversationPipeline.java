package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStore;
import io.github.drompincen.restochat.persistence.checkpoint.ConversationSnapshot;
import io.github.drompincen.restochat.protocol.api.Intent;
import io.github.drompincen.restochat.protocol.api.MemorySource;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.llm.ModelCallException;
import io.github.drompincen.restochat.runtime.agent.planning.ClarificationPolicy;
import io.github.drompincen.restochat.runtime.agent.planning.IntentClassifier;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlan;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlanner;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfile;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfiles;
import io.github.drompincen.restochat.runtime.agent.respond.Responder;
import io.github.drompincen.restochat.runtime.agent.respond.Summarizer;
import io.github.drompincen.restochat.runtime.memory.MemoryService;
import io.github.drompincen.restochat.runtime.tools.Tool;
import io.github.drompincen.restochat.runtime.tools.ToolContext;
import io.github.drompincen.restochat.runtime.tools.ToolExecutor;
import io.github.drompincen.restochat.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs one turn: load the checkpoint, walk the stage machine from START to END, save the
 * checkpoint. Callers must hold the thread's lock for the whole call.
 */
public class ConversationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversationPipeline.class);

    private final CheckpointStore checkpointStore;
    private final MemoryService memoryService;
    private final IntentClassifier intentClassifier;
    private final QueryPlanner queryPlanner;
    private final ClarificationPolicy clarificationPolicy;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final Responder responder;
    private final Summarizer summarizer;
    private final PersonaProfiles profiles;
    private final TurnTransitions transitions;
    private final int historyWindow;
    private final int maxSteps;

    public ConversationPipeline(CheckpointStore checkpointStore, MemoryService memoryService,
                                IntentClassifier intentClassifier, QueryPlanner queryPlanner,
                                ClarificationPolicy clarificationPolicy, ToolRegistry toolRegistry,
                                ToolExecutor toolExecutor, Responder responder, Summarizer summarizer,
                                PersonaProfiles profiles, TurnTransitions transitions,
                                int historyWindow, int maxSteps) {
        this.checkpointStore = checkpointStore;
        this.memoryService = memoryService;
        this.intentClassifier = intentClassifier;
        this.queryPlanner = queryPlanner;
        this.clarificationPolicy = clarificationPolicy;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.responder = responder;
        this.summarizer = summarizer;
        this.profiles = profiles;
        this.transitions = transitions;
        this.historyWindow = historyWindow;
        this.maxSteps = maxSteps;
    }

    /**
     * @throws ModelCallException when the responder cannot produce a reply; nothing is saved then
     * @throws StepLimitExceededException when the stage machine does not reach END in time
     * @throws ThreadOwnershipException when the thread was started under the other persona;
     *         nothing is read from or written to the thread then
     */
    public TurnState run(String text, String threadId, Persona persona) {
        ConversationSnapshot snapshot = checkpointStore.get(threadId).orElse(ConversationSnapshot.empty());
        if (!snapshot.ownedBy(persona)) {
            log.warn("Refusing {} turn on thread owned by {}", persona, snapshot.persona());
            throw new ThreadOwnershipException(threadId, snapshot.persona(), persona);
        }
        memoryService.capture(threadId, text, MemorySource.USER);
        String note = memoryService.buildNote(threadId).orElse(null);

        TurnState state = TurnState.start(threadId, persona, snapshot.window(historyWindow),
                snapshot.summary(), note, text);
        state = execute(state);

        checkpointStore.put(threadId, new ConversationSnapshot(persona, state.messages(), state.summary()));
        memoryService.capture(threadId, state.reply(), MemorySource.ASSISTANT);
        return state;
    }

    TurnState execute(TurnState initial) {
        TurnState state = initial;
        PipelineStage stage = PipelineStage.START;
        int steps = 0;
        while (stage != PipelineStage.END) {
            if (++steps > maxSteps) {
                throw new StepLimitExceededException(maxSteps, stage);
            }
            state = runStage(stage, state);
            PipelineStage next = transitions.next(stage, state);
            log.debug("Stage {} -> {}", stage, next);
            stage = next;
        }
        return state;
    }

    private TurnState runStage(PipelineStage stage, TurnState state) {
        PersonaProfile profile = profiles.get(state.persona());
        return switch (stage) {
            case START, END -> state;
            case DETECT_INTENT -> state.withIntent(detectIntent(state.userMessage(), state.persona()));
            case PLAN -> plan(state, profile);
            case CLARIFY -> state.withReply(state.clarifyQuestion());
            case EXEC -> {
                ToolContext ctx = new ToolContext(state.threadId(), state.persona());
                yield state.withToolResult(toolExecutor.execute(state.plan(), allowedTools(profile), ctx));
            }
            case RESPOND -> state.withReply(responder.respond(profile, state.memoryNote(), state.summary(),
                    state.history(), state.userMessage(), state.toolResult()));
            case SUMMARIZE -> state.withSummary(
                    summarizer.summarize(state.summary(), state.userMessage(), state.reply()));
        };
    }

    private Intent detectIntent(String text, Persona persona) {
        try {
            Intent intent = intentClassifier.classify(text, persona);
            log.info("Intent: {}", intent);
            return intent;
        } catch (ModelCallException e) {
            log.warn("Intent classification failed, answering conversationally: {}", e.getMessage());
            return Intent.CONVERSATIONAL;
        }
    }

    private TurnState plan(TurnState state, PersonaProfile profile) {
        Optional<QueryPlan> plan;
        try {
            plan = queryPlanner.plan(state.userMessage(), allowedTools(profile), profile.modelConfig());
        } catch (ModelCallException e) {
            log.warn("Planning failed, answering without data: {}", e.getMessage());
            plan = Optional.empty();
        }
        if (plan.isEmpty()) {
            return state;
        }
        log.info("Plan: {} {}", plan.get().toolName(), plan.get().args());
        TurnState planned = state.withPlan(plan.get());
        Optional<String> question = clarificationPolicy.clarify(plan.get());
        return question.map(planned::withClarifyQuestion).orElse(planned);
    }

    private List<Tool> allowedTools(PersonaProfile profile) {
        return toolRegistry.forPersona(profile.persona(), profile.toolWhitelist());
    }
}
