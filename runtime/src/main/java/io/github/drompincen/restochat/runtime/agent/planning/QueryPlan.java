package io.github.drompincen.restochat.runtime.agent.planning;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Tool name plus a flat argument object chosen for a data lookup. */
public record QueryPlan(
        String toolName,
        ObjectNode args
) {
    public boolean hasArg(String name) {
        return args.hasNonNull(name) && !args.get(name).asText().isBlank();
    }

    public boolean hasAnyArg(Iterable<String> names) {
        for (String name : names) {
            if (hasArg(name)) return true;
        }
        return false;
    }
}
