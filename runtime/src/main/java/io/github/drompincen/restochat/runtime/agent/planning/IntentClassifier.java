package io.github.drompincen.restochat.runtime.agent.planning;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.Intent;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.llm.LlmPurpose;
import io.github.drompincen.restochat.runtime.agent.llm.LlmRequest;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;

import java.util.List;
import java.util.Locale;

public class IntentClassifier {

    static final String INSTRUCTIONS = """
            Classify the user message. If answering requires querying any restaurant database \
            (employees, recipes, storage/inventory, daily menu), return db_query. \
            If it can be answered conversationally without data lookup, return conversational.
            Return only one token: db_query or conversational.""";

    /** Guests can only reach the daily menu, so nothing else is worth a lookup. */
    static final String GUEST_INSTRUCTIONS = """
            Classify the guest message. If answering requires looking up today's menu \
            (dishes, prices, ingredients, vegetarian, vegan or gluten-free options), return db_query. \
            Anything else, including questions about staff or the kitchen's internal records, \
            is conversational.
            Return only one token: db_query or conversational.""";

    private final TimedLlmCaller llm;

    public IntentClassifier(TimedLlmCaller llm) {
        this.llm = llm;
    }

    /** Throws {@link io.github.drompincen.restochat.runtime.agent.llm.ModelCallException} on model failure. */
    public Intent classify(String utterance, Persona persona) {
        String raw = llm.call(new LlmRequest(LlmPurpose.CLASSIFY,
                List.of(ChatMessage.system(instructionsFor(persona)), ChatMessage.user(utterance)), 0.0));
        return parse(raw);
    }

    static String instructionsFor(Persona persona) {
        return persona == Persona.EXTERNAL ? GUEST_INSTRUCTIONS : INSTRUCTIONS;
    }

    static Intent parse(String raw) {
        String out = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return out.startsWith("db_query") ? Intent.DB_QUERY : Intent.CONVERSATIONAL;
    }
}
