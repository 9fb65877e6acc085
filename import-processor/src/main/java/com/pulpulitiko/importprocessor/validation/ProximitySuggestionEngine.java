package com.pulpulitiko.importprocessor.validation;

import com.pulpulitiko.importprocessor.config.ImportProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks candidates by how the lower-cased input and candidate relate:
 * <ol start="0">
 *   <li>the candidate contains the input (so also when the input is its prefix)</li>
 *   <li>the input contains the candidate</li>
 *   <li>neither contains the other, but they are within a small edit distance
 *       (optimal string alignment, so a swapped pair of letters counts once)</li>
 * </ol>
 * Ties keep catalog order. Rank 2 allows at most {@code max-edit-distance} edits and never more
 * than a third of the input's length, so very short inputs only get containment matches.
 */
@Component
public class ProximitySuggestionEngine implements SuggestionEngine {

    private final int maxEditDistance;

    @Autowired
    public ProximitySuggestionEngine(ImportProperties importProperties) {
        this(importProperties.getSuggestions().getMaxEditDistance());
    }

    public ProximitySuggestionEngine(int maxEditDistance) {
        this.maxEditDistance = Math.max(0, maxEditDistance);
    }

    @Override
    public List<String> suggest(String target, List<String> candidates, int limit) {
        String needle = target == null ? "" : target.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty() || limit <= 0) {
            return List.of();
        }
        int allowedEdits = Math.min(maxEditDistance, needle.length() / 3);

        List<Match> matches = new ArrayList<>();
        for (String candidate : candidates) {
            String hay = candidate.toLowerCase(Locale.ROOT);
            if (hay.contains(needle)) {
                matches.add(new Match(candidate, 0, 0));
            } else if (needle.contains(hay)) {
                matches.add(new Match(candidate, 1, 0));
            } else if (allowedEdits > 0) {
                int distance = editDistance(needle, hay, allowedEdits);
                if (distance <= allowedEdits) {
                    matches.add(new Match(candidate, 2, distance));
                }
            }
        }
        // List.sort is stable
        matches.sort(Comparator.comparingInt(Match::rank).thenComparingInt(Match::distance));
        return matches.stream().limit(limit).map(Match::candidate).toList();
    }

    /**
     * Optimal string alignment distance, or {@code bound + 1} as soon as it must exceed {@code bound}.
     */
    static int editDistance(String a, String b, int bound) {
        if (Math.abs(a.length() - b.length()) > bound) {
            return bound + 1;
        }
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            int rowMin = Integer.MAX_VALUE;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                int value = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
                    value = Math.min(value, d[i - 2][j - 2] + 1);
                }
                d[i][j] = value;
                rowMin = Math.min(rowMin, value);
            }
            if (rowMin > bound) {
                return bound + 1;
            }
        }
        return Math.min(d[a.length()][b.length()], bound + 1);
    }

    private record Match(String candidate, int rank, int distance) {
    }
}
