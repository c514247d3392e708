package io.github.drompincen.restochat.runtime.agent.llm;

/** Which pipeline step issued a model call. Used for logging and by the fake backend. */
public enum LlmPurpose {
    CLASSIFY,
    PLAN,
    RESPOND,
    SUMMARIZE
}
