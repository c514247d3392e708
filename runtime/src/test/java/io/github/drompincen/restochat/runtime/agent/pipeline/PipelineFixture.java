package io.github.drompincen.restochat.runtime.agent.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStore;
import io.github.drompincen.restochat.persistence.checkpoint.JdbcCheckpointStore;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.persistence.schema.SchemaInitializer;
import io.github.drompincen.restochat.runtime.agent.llm.ScriptedLlm;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;
import io.github.drompincen.restochat.runtime.agent.planning.ClarificationPolicy;
import io.github.drompincen.restochat.runtime.agent.planning.DishNameSalvage;
import io.github.drompincen.restochat.runtime.agent.planning.IntentClassifier;
import io.github.drompincen.restochat.runtime.agent.planning.PlanParser;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlanner;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfiles;
import io.github.drompincen.restochat.runtime.agent.respond.Responder;
import io.github.drompincen.restochat.runtime.agent.respond.Summarizer;
import io.github.drompincen.restochat.runtime.memory.FactExtractor;
import io.github.drompincen.restochat.runtime.memory.MemoryService;
import io.github.drompincen.restochat.runtime.tools.ToolExecutor;
import io.github.drompincen.restochat.runtime.tools.ToolRegistry;
import org.springframework.context.ApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.util.UUID;

import static org.mockito.Mockito.mock;

/** Real pipeline over an in-memory H2 database with a scripted model. */
public class PipelineFixture {

    public final ScriptedLlm llm = new ScriptedLlm();
    public final JdbcTemplate jdbc;
    public final CheckpointStore checkpoints;
    public final MemoryRepository memories;
    public final ToolRegistry registry = new ToolRegistry(mock(ApplicationContext.class));

    public PipelineFixture() {
        jdbc = new JdbcTemplate(new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", ""));
        new SchemaInitializer(jdbc).initialize();
        checkpoints = new JdbcCheckpointStore(jdbc, new ObjectMapper());
        memories = new MemoryRepository(jdbc);
    }

    public ConversationPipeline pipeline() {
        return pipeline(TurnTransitions.standard(), 16);
    }

    public ConversationPipeline pipeline(TurnTransitions transitions, int maxSteps) {
        TimedLlmCaller caller = new TimedLlmCaller(llm, Duration.ofSeconds(5));
        return new ConversationPipeline(
                checkpoints,
                new MemoryService(memories, new FactExtractor()),
                new IntentClassifier(caller),
                new QueryPlanner(caller, new PlanParser(new ObjectMapper()), new DishNameSalvage()),
                new ClarificationPolicy(),
                registry,
                new ToolExecutor(Duration.ofSeconds(5)),
                new Responder(caller, true),
                new Summarizer(caller),
                PersonaProfiles.defaults(),
                transitions,
                20,
                maxSteps);
    }
}
