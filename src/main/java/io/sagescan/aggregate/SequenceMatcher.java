package io.sagescan.aggregate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Ratcliff/Obershelp string similarity.
 * <p>
 * The longest common block is found first, then the parts left and right of it are matched
 * recursively. Among equally long blocks the one starting earliest in {@code a} wins, then the
 * one starting earliest in {@code b}.
 * <p>
 * When {@code b} has at least {@value #AUTOJUNK_MIN_LENGTH} characters, any character
 * occurring more than {@code 1 + b.length() / 100} times in it is "popular": it cannot seed a
 * matching block, only extend one found through other characters. Long texts dominated by a
 * few characters therefore score lower than a plain longest-common-substring count would give.
 */
public final class SequenceMatcher {

    static final int AUTOJUNK_MIN_LENGTH = 200;

    private SequenceMatcher() {
    }

    /**
     * Returns {@code 2 * M / T}, where M is the number of matched characters and T the total
     * length of both strings; 1.0 when both are empty.
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Number of characters in all matching blocks.
     */
    public static int matchingCharacters(String a, String b) {
        Set<Character> popular = popularCharacters(b);
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];
            int[] match = longestMatch(a, alo, ahi, b, blo, bhi, popular);
            int i = match[0];
            int j = match[1];
            int k = match[2];
            if (k == 0) {
                continue;
            }
            matched += k;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    /**
     * Characters of {@code b} too frequent to seed a match; empty for short strings.
     */
    static Set<Character> popularCharacters(String b) {
        int n = b.length();
        if (n < AUTOJUNK_MIN_LENGTH) {
            return Set.of();
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int j = 0; j < n; j++) {
            counts.merge(b.charAt(j), 1, Integer::sum);
        }
        int limit = n / 100 + 1;
        Set<Character> popular = new HashSet<>();
        counts.forEach((c, count) -> {
            if (count > limit) {
                popular.add(c);
            }
        });
        return popular;
    }

    /**
     * Longest block {@code a[i, i+k) == b[j, j+k)} within the given ranges, as {@code {i, j, k}}.
     * The block is seeded from non-popular characters and then widened over equal neighbours.
     */
    static int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi, Set<Character> popular) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;
        int width = bhi - blo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        for (int i = alo; i < ahi; i++) {
            char c = a.charAt(i);
            boolean seeds = !popular.contains(c);
            for (int j = blo; j < bhi; j++) {
                int slot = j - blo + 1;
                if (seeds && c == b.charAt(j)) {
                    int k = previous[slot - 1] + 1;
                    current[slot] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                } else {
                    current[slot] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        while (bestI > alo && bestJ > blo && a.charAt(bestI - 1) == b.charAt(bestJ - 1)) {
            bestI--;
            bestJ--;
            bestSize++;
        }
        while (bestI + bestSize < ahi && bestJ + bestSize < bhi
                && a.charAt(bestI + bestSize) == b.charAt(bestJ + bestSize)) {
            bestSize++;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
