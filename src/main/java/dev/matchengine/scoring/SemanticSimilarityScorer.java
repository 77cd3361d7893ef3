package dev.matchengine.scoring;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-overlap similarity between two free-text blobs.
 */
@Component
public class SemanticSimilarityScorer {

    private static final int MAX_TEXT_LENGTH = 20_000;
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "are", "you", "our", "will", "from", "this", "that");

    public OptionalDouble similarity(String a, String b) {
        Set<String> tokensA = tokens(a);
        Set<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return OptionalDouble.empty();
        }
        Set<String> smaller = tokensA.size() <= tokensB.size() ? tokensA : tokensB;
        Set<String> larger = smaller == tokensA ? tokensB : tokensA;
        long shared = smaller.stream().filter(larger::contains).count();
        return OptionalDouble.of((double) shared / Math.max(tokensA.size(), tokensB.size()));
    }

    Set<String> tokens(String text) {
        Set<String> result = new HashSet<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        String bounded = text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
        Matcher matcher = TOKEN.matcher(bounded);
        while (matcher.find()) {
            String token = matcher.group().toLowerCase(Locale.ROOT);
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                result.add(token);
            }
        }
        return result;
    }
}
