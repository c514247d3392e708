package io.github.drompincen.restochat.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStore;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.runtime.agent.ChatService;
import io.github.drompincen.restochat.runtime.agent.llm.LlmService;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;
import io.github.drompincen.restochat.runtime.agent.pipeline.ConversationPipeline;
import io.github.drompincen.restochat.runtime.agent.pipeline.TurnTransitions;
import io.github.drompincen.restochat.runtime.agent.planning.ClarificationPolicy;
import io.github.drompincen.restochat.runtime.agent.planning.DishNameSalvage;
import io.github.drompincen.restochat.runtime.agent.planning.IntentClassifier;
import io.github.drompincen.restochat.runtime.agent.planning.PlanParser;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlanner;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfiles;
import io.github.drompincen.restochat.runtime.agent.respond.Responder;
import io.github.drompincen.restochat.runtime.agent.respond.Summarizer;
import io.github.drompincen.restochat.runtime.lock.ThreadLockService;
import io.github.drompincen.restochat.runtime.memory.FactExtractor;
import io.github.drompincen.restochat.runtime.memory.MemoryService;
import io.github.drompincen.restochat.runtime.tools.ToolExecutor;
import io.github.drompincen.restochat.runtime.tools.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

@Configuration
public class RuntimeConfig {

    @Bean
    TurnSettings turnSettings(Environment env) {
        TurnSettings d = TurnSettings.defaults();
        return new TurnSettings(
                env.getProperty("restochat.turn.history-window", Integer.class, d.historyWindow()),
                env.getProperty("restochat.turn.max-steps", Integer.class, d.maxSteps()),
                env.getProperty("restochat.turn.lock-timeout", Duration.class, d.lockTimeout()),
                env.getProperty("restochat.llm.timeout", Duration.class, d.modelTimeout()),
                env.getProperty("restochat.tools.timeout", Duration.class, d.toolTimeout()),
                env.getProperty("restochat.suggestions.enabled", Boolean.class, d.suggestionsEnabled()),
                env.getProperty("restochat.memory-tools.enabled", Boolean.class, d.memoryToolsEnabled()));
    }

    @Bean
    PersonaProfiles personaProfiles(TurnSettings settings, Environment env) {
        return new PersonaProfiles(settings.memoryToolsEnabled(),
                env.getProperty("restochat.temperature.internal", Double.class, 0.1),
                env.getProperty("restochat.temperature.external", Double.class, 0.3),
                settings.modelTimeout());
    }

    @Bean
    TimedLlmCaller timedLlmCaller(LlmService llmService, TurnSettings settings) {
        return new TimedLlmCaller(llmService, settings.modelTimeout());
    }

    @Bean
    MemoryService memoryService(MemoryRepository memoryRepository, Environment env) {
        String[] stoplist = env.getProperty("restochat.memory.name-stoplist", String[].class);
        FactExtractor extractor = stoplist == null
                ? new FactExtractor()
                : new FactExtractor(FactExtractor.DEFAULT_RULES, Arrays.stream(stoplist)
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toSet()));
        return new MemoryService(memoryRepository, extractor);
    }

    @Bean
    ConversationPipeline conversationPipeline(CheckpointStore checkpointStore, MemoryService memoryService,
                                              TimedLlmCaller llm, ToolRegistry toolRegistry,
                                              PersonaProfiles profiles, TurnSettings settings,
                                              ObjectMapper objectMapper) {
        return new ConversationPipeline(
                checkpointStore,
                memoryService,
                new IntentClassifier(llm),
                new QueryPlanner(llm, new PlanParser(objectMapper), new DishNameSalvage()),
                new ClarificationPolicy(),
                toolRegistry,
                new ToolExecutor(settings.toolTimeout()),
                new Responder(llm, settings.suggestionsEnabled()),
                new Summarizer(llm),
                profiles,
                TurnTransitions.standard(),
                settings.historyWindow(),
                settings.maxSteps());
    }

    @Bean
    ThreadLockService threadLockService() {
        return new ThreadLockService();
    }

    @Bean
    ChatService chatService(ConversationPipeline pipeline, ThreadLockService lockService, TurnSettings settings) {
        return new ChatService(pipeline, lockService, settings.lockTimeout());
    }
}
