package org.clerasense.domain.service.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ratcliff/Obershelp "gestalt" similarity over characters.
 * <p>
 * Score is {@code 2*M / (|a| + |b|)} where M is the number of characters in the
 * recursively found longest common blocks. For texts of 200+ characters, characters
 * occurring in more than 1% of the second text are not used as block anchors,
 * which keeps long label sections from matching on whitespace and vowels alone.
 */
public final class TextSimilarity {

    private static final int POPULAR_MIN_LENGTH = 200;

    private TextSimilarity() {}

    /**
     * Case-insensitive similarity in [0,1]. Empty or null input scores 0,
     * identical input (after trim + lower-case) scores 1.
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0.0;
        String x = a.toLowerCase(Locale.ROOT).strip();
        String y = b.toLowerCase(Locale.ROOT).strip();
        if (x.equals(y)) return 1.0;
        return ratio(x, y);
    }

    /** Raw ratio without normalisation. */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> b2j = indexOf(b);
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] r = queue.pop();
            int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
            int[] m = longestMatch(a, b, b2j, alo, ahi, blo, bhi);
            int i = m[0], j = m[1], k = m[2];
            if (k > 0) {
                matched += k;
                if (alo < i && blo < j) queue.push(new int[]{alo, i, blo, j});
                if (i + k < ahi && j + k < bhi) queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    private static Map<Character, List<Integer>> indexOf(String b) {
        Map<Character, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            b2j.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }
        int n = b.length();
        if (n >= POPULAR_MIN_LENGTH) {
            int threshold = n / 100 + 1;
            Set<Character> popular = new HashSet<>();
            for (var e : b2j.entrySet()) {
                if (e.getValue().size() > threshold) popular.add(e.getKey());
            }
            popular.forEach(b2j::remove);
        }
        return b2j;
    }

    private static int[] longestMatch(String a, String b, Map<Character, List<Integer>> b2j,
                                      int alo, int ahi, int blo, int bhi) {
        int besti = alo, bestj = blo, bestsize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            List<Integer> js = b2j.get(a.charAt(i));
            if (js != null) {
                for (int j : js) {
                    if (j < blo) continue;
                    if (j >= bhi) break;
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    next.put(j, k);
                    if (k > bestsize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestsize = k;
                    }
                }
            }
            j2len = next;
        }
        // widen the block over characters that were dropped from the index
        while (besti > alo && bestj > blo && a.charAt(besti - 1) == b.charAt(bestj - 1)) {
            besti--;
            bestj--;
            bestsize++;
        }
        while (besti + bestsize < ahi && bestj + bestsize < bhi
                && a.charAt(besti + bestsize) == b.charAt(bestj + bestsize)) {
            bestsize++;
        }
        return new int[]{besti, bestj, bestsize};
    }
}
