package dev.matchengine.scoring;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Fuzzy partial-match similarity between two job titles.
 * <p>
 * Titles are normalized (lower case, punctuation dropped) and compared both as
 * written and with their words sorted, so reordered titles like
 * "Senior Developer" and "Developer, Senior" still score 1.0. The comparison
 * slides the shorter title over the longer one and keeps the best
 * longest-common-subsequence ratio {@code 2*LCS/(|a|+|b|)}. The result is
 * symmetric and within [0,1].
 */
@Component
public class TitleSimilarityScorer {

    private static final int MAX_TITLE_LENGTH = 200;
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    /**
     * Empty when either title is blank after normalization.
     */
    public OptionalDouble similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return OptionalDouble.empty();
        }
        double direct = partialRatio(left, right);
        if (direct >= 1.0) {
            return OptionalDouble.of(1.0);
        }
        double sorted = partialRatio(sortTokens(left), sortTokens(right));
        return OptionalDouble.of(Math.max(direct, sorted));
    }

    static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String bounded = title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
        return NON_ALNUM.matcher(bounded.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    static String sortTokens(String normalized) {
        String[] tokens = normalized.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    static double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int window = shorter.length();

        double best = 0.0;
        for (int start = 0; start + window <= longer.length(); start++) {
            double ratio = ratio(shorter, longer.substring(start, start + window));
            if (ratio > best) {
                best = ratio;
                if (best >= 1.0) {
                    break;
                }
            }
        }
        return best;
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 0.0;
        }
        return 2.0 * longestCommonSubsequence(a, b) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
