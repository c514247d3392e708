package io.github.drompincen.restochat.runtime.memory;

import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One (pattern, key) pair of the fact extractor. Group 1 of the pattern is the value; the
 * normalizer cleans it up before it is stored.
 */
public record FactRule(
        String key,
        Pattern pattern,
        int importance,
        UnaryOperator<String> normalizer
) {
    public static FactRule of(String key, String regex, int importance) {
        return new FactRule(key, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), importance, FactRule::clean);
    }

    public Optional<String> match(String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String value = normalizer.apply(m.group(1));
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /** Trims whitespace and trailing punctuation, and keeps only the first clause. */
    static String clean(String raw) {
        if (raw == null) return null;
        String v = raw.strip();
        int cut = indexOfAny(v, ".!?;\n");
        if (cut >= 0) v = v.substring(0, cut);
        v = v.replaceAll("\\s+(?:and|but)\\s+.*$", "");
        return v.replaceAll("[\\s,:\"']+$", "").strip();
    }

    private static int indexOfAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) return i;
        }
        return -1;
    }
}
