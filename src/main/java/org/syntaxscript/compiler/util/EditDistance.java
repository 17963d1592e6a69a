package org.syntaxscript.compiler.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Levenshtein distance and nearest-candidate ranking, used to suggest replacements for misspelled words.
 */
public final class EditDistance {

    private EditDistance() {}

    /**
     * Computes the minimum number of single-character insertions, deletions and substitutions
     * that turn one string into the other.
     * @param a The first string.
     * @param b The second string.
     * @return The edit distance, 0 for equal strings.
     */
    public static int between(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Orders candidates by their distance to the target, nearest first. Candidates at the same
     * distance keep their original order, duplicates are dropped.
     * @param target     The word to match.
     * @param candidates The candidates.
     * @return The ranked candidates.
     */
    public static List<String> rank(String target, Collection<String> candidates) {
        return candidates.stream()
                .distinct()
                .sorted(Comparator.comparingInt(c -> between(target, c)))
                .toList();
    }
}
