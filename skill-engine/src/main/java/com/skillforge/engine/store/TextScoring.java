package com.skillforge.engine.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Token-level scoring used by {@link InMemorySkillStore} in place of the
 * external engine's analyzers.
 */
final class TextScoring {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "in", "is",
            "it", "of", "on", "or", "that", "the", "this", "to", "with");

    private TextScoring() {}

    /** Lowercase alphanumeric tokens, stop words dropped, trailing plural 's' folded. */
    static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (raw.isEmpty() || STOP_WORDS.contains(raw)) continue;
            out.add(raw.length() > 3 && raw.endsWith("s") && !raw.endsWith("ss")
                    ? raw.substring(0, raw.length() - 1)
                    : raw);
        }
        return out;
    }

    /**
     * Keyword score: 2 per query token found in the name, 1 per token found in
     * the description, plus 3 when the whole query appears verbatim in either.
     */
    static double keyword(String query, String name, String description) {
        List<String> nameTokens = tokens(name);
        List<String> descTokens = tokens(description);
        double score = 0;
        for (String token : tokens(query)) {
            if (nameTokens.contains(token)) score += 2;
            if (descTokens.contains(token)) score += 1;
        }
        String phrase = query.strip().toLowerCase(Locale.ROOT);
        if (!phrase.isEmpty()
                && (name.toLowerCase(Locale.ROOT).contains(phrase)
                    || description.toLowerCase(Locale.ROOT).contains(phrase))) {
            score += 3;
        }
        return score;
    }

    /** Cosine similarity of term-frequency vectors, in [0, 1]. */
    static double cosine(String query, String document) {
        Map<String, Integer> q = frequencies(tokens(query));
        Map<String, Integer> d = frequencies(tokens(document));
        if (q.isEmpty() || d.isEmpty()) return 0;
        double dot = 0;
        for (Map.Entry<String, Integer> e : q.entrySet()) {
            dot += e.getValue() * d.getOrDefault(e.getKey(), 0);
        }
        return dot == 0 ? 0 : dot / (norm(q) * norm(d));
    }

    private static Map<String, Integer> frequencies(List<String> tokens) {
        Map<String, Integer> tf = new HashMap<>();
        tokens.forEach(t -> tf.merge(t, 1, Integer::sum));
        return tf;
    }

    private static double norm(Map<String, Integer> tf) {
        double sum = 0;
        for (int v : tf.values()) sum += (double) v * v;
        return Math.sqrt(sum);
    }
}
