package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.Intent;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable state of one turn. {@code history} is the window loaded from the checkpoint,
 * {@code turnMessages} what this turn appended; {@link #messages()} is what gets saved.
 */
public final class TurnState {

    private final String threadId;
    private final Persona persona;
    private final List<ChatMessage> history;
    private final List<ChatMessage> turnMessages;
    private final String userMessage;
    private final String summary;
    private final String memoryNote;
    private final Intent intent;
    private final QueryPlan plan;
    private final String toolResult;
    private final String clarifyQuestion;
    private final String reply;

    private TurnState(String threadId, Persona persona, List<ChatMessage> history, List<ChatMessage> turnMessages,
                      String userMessage, String summary, String memoryNote, Intent intent, QueryPlan plan,
                      String toolResult, String clarifyQuestion, String reply) {
        this.threadId = threadId;
        this.persona = persona;
        this.history = List.copyOf(history);
        this.turnMessages = List.copyOf(turnMessages);
        this.userMessage = userMessage;
        this.summary = summary;
        this.memoryNote = memoryNote;
        this.intent = intent;
        this.plan = plan;
        this.toolResult = toolResult;
        this.clarifyQuestion = clarifyQuestion;
        this.reply = reply;
    }

    /** Opening state of a turn: the user message is already appended. */
    public static TurnState start(String threadId, Persona persona, List<ChatMessage> history, String summary,
                                  String memoryNote, String userMessage) {
        return new TurnState(threadId, persona, history, List.of(ChatMessage.user(userMessage)),
                userMessage, summary, memoryNote, null, null, null, null, null);
    }

    public String threadId() { return threadId; }
    public Persona persona() { return persona; }
    public List<ChatMessage> history() { return history; }
    public List<ChatMessage> turnMessages() { return turnMessages; }
    public String userMessage() { return userMessage; }
    public String summary() { return summary; }
    public String memoryNote() { return memoryNote; }
    public Intent intent() { return intent; }
    public QueryPlan plan() { return plan; }
    public String toolResult() { return toolResult; }
    public String clarifyQuestion() { return clarifyQuestion; }
    public String reply() { return reply; }

    public List<ChatMessage> messages() {
        List<ChatMessage> all = new ArrayList<>(history.size() + turnMessages.size());
        all.addAll(history);
        all.addAll(turnMessages);
        return all;
    }

    public TurnState withIntent(Intent intent) {
        if (this.intent != null) {
            throw new IllegalStateException("intent already set for this turn");
        }
        return new TurnState(threadId, persona, history, turnMessages, userMessage, summary, memoryNote,
                intent, plan, toolResult, clarifyQuestion, reply);
    }

    public TurnState withPlan(QueryPlan plan) {
        return new TurnState(threadId, persona, history, turnMessages, userMessage, summary, memoryNote,
                intent, plan, toolResult, clarifyQuestion, reply);
    }

    public TurnState withClarifyQuestion(String question) {
        if (toolResult != null) {
            throw new IllegalStateException("cannot ask for clarification after a tool ran");
        }
        return new TurnState(threadId, persona, history, turnMessages, userMessage, summary, memoryNote,
                intent, plan, toolResult, question, reply);
    }

    public TurnState withToolResult(String result) {
        if (clarifyQuestion != null) {
            throw new IllegalStateException("cannot run a tool once a clarification was asked");
        }
        return new TurnState(threadId, persona, history, append(ChatMessage.tool(result)), userMessage, summary,
                memoryNote, intent, plan, result, clarifyQuestion, reply);
    }

    /** Sets the single assistant output of the turn. */
    public TurnState withReply(String reply) {
        if (this.reply != null) {
            throw new IllegalStateException("turn already has an assistant reply");
        }
        return new TurnState(threadId, persona, history, append(ChatMessage.assistant(reply)), userMessage,
                summary, memoryNote, intent, plan, toolResult, clarifyQuestion, reply);
    }

    public TurnState withSummary(String summary) {
        return new TurnState(threadId, persona, history, turnMessages, userMessage, summary, memoryNote,
                intent, plan, toolResult, clarifyQuestion, reply);
    }

    private List<ChatMessage> append(ChatMessage message) {
        List<ChatMessage> next = new ArrayList<>(turnMessages);
        next.add(message);
        return next;
    }
}
