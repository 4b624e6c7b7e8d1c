package com.infra.whatif.engine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp similarity: the longest common block is found, then the same is
 * done recursively on the pieces to its left and right. The ratio is
 * {@code 2 * matched / (len(a) + len(b))}, in [0.0, 1.0].
 */
public final class SimilarityRatio {

    private SimilarityRatio() {}

    public static double of(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedCharacters(a, b) / total;
    }

    static int matchedCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});

        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
            int[] block = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                ranges.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                ranges.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest block with a[i..i+size) == b[j..j+size) inside the given ranges. Among
     * equally long blocks the one starting earliest in a (then in b) wins.
     */
    private static int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        // runLength[j + 1] = length of the match ending at a[i], b[j]
        int[] runLength = new int[b.length() + 1];

        for (int i = alo; i < ahi; i++) {
            int[] next = new int[b.length() + 1];
            char c = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (b.charAt(j) != c) {
                    continue;
                }
                int k = runLength[j] + 1;
                next[j + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            runLength = next;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
