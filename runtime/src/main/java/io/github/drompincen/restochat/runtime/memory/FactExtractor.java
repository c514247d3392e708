package io.github.drompincen.restochat.runtime.memory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans one utterance against an ordered rule list; the first matching rule wins.
 * Diet, allergy and like/dislike rules sit ahead of the bare "I'm X" name rule so
 * "I'm vegan" is not taken for a name.
 */
public class FactExtractor {

    public static final String USER_NAME = "user_name";
    public static final String PREFERENCE = "preference";
    public static final String DISLIKE = "dislike";
    public static final String DIETARY = "dietary";
    public static final String ALLERGY = "allergy";
    public static final String NOTE = "note";

    public static final Set<String> DEFAULT_NAME_STOPLIST = Set.of("what", "who", "where", "why", "how", "when");

    private static final String IM = "\\bi(?:'|\u2019)?m|\\bi am";

    public static final List<FactRule> DEFAULT_RULES = List.of(
            FactRule.of(USER_NAME, "\\b(?:my name is|my name's|call me)\\s+(\\p{L}[\\p{L}'-]*(?:\\s+(?-i:\\p{Lu})[\\p{L}'-]+)?)", 3),
            FactRule.of(ALLERGY, "\\ballergic to\\s+([^.!?;\\n]+)", 5),
            new FactRule(DIETARY, Pattern.compile("(?:" + IM + "|\\bi eat)\\s+(?:a\\s+|strictly\\s+)?"
                    + "(vegan|vegetarian|pescatarian|gluten[- ]free|dairy[- ]free|lactose[- ]intolerant|halal|kosher)\\b",
                    Pattern.CASE_INSENSITIVE), 4, v -> v.toLowerCase(Locale.ROOT).replace(' ', '-')),
            FactRule.of(DISLIKE, "\\bi (?:don't|dont|do not|don\u2019t) (?:like|enjoy|eat)\\s+([^.!?;\\n]+)", 2),
            FactRule.of(DISLIKE, "\\bi (?:dislike|hate)\\s+([^.!?;\\n]+)", 2),
            FactRule.of(PREFERENCE, "\\bi (?:really )?(?:like|love|prefer|enjoy)\\s+([^.!?;\\n]+)", 2),
            FactRule.of(NOTE, "\\b(?:please remember(?: that)?|remember that)\\s+([^.!?\\n]+)", 2),
            // bare "I'm Sam": only a capitalized word counts as a name
            new FactRule(USER_NAME, Pattern.compile("(?i:" + IM + ")\\s+(\\p{Lu}[\\p{L}'-]+)(?=\\s*(?:[.!?,;]|$))"),
                    3, FactRule::clean)
    );

    private final List<FactRule> rules;
    private final Set<String> nameStoplist;

    public FactExtractor() {
        this(DEFAULT_RULES, DEFAULT_NAME_STOPLIST);
    }

    public FactExtractor(List<FactRule> rules, Set<String> nameStoplist) {
        this.rules = List.copyOf(rules);
        this.nameStoplist = Set.copyOf(nameStoplist);
    }

    /**
     * @param knownName the thread's current name, used when the candidate name is a question word
     */
    public Optional<ExtractedFact> extract(String text, String knownName) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (FactRule rule : rules) {
            Optional<String> value = rule.match(text);
            if (value.isEmpty()) continue;
            if (USER_NAME.equals(rule.key()) && isStopword(value.get())) {
                return knownName == null ? Optional.empty()
                        : Optional.of(new ExtractedFact(USER_NAME, knownName, rule.importance()));
            }
            return Optional.of(new ExtractedFact(rule.key(), value.get(), rule.importance()));
        }
        return Optional.empty();
    }

    private boolean isStopword(String name) {
        String first = name.split("\\s+")[0].toLowerCase(Locale.ROOT);
        return nameStoplist.contains(first);
    }
}
