package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.GenomicInterval;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds maximal runs of target letters in a sequence, e.g. the stretches of a genome without N.
 */
public class TargetRegionFinder {
    private final boolean[] targets = new boolean[256];

    /**
     * @param targetLetters letters to look for
     * @param caseSensitive if false, the lowercase and uppercase forms of every letter are targets
     */
    public TargetRegionFinder(String targetLetters, boolean caseSensitive) {
        for (char letter : targetLetters.toCharArray()) {
            if (letter > 255) {
                throw new IllegalArgumentException("Target letter is not a nucleotide code: " + letter);
            }
            targets[letter] = true;
            if (!caseSensitive) {
                targets[Character.toLowerCase(letter)] = true;
                targets[Character.toUpperCase(letter)] = true;
            }
        }
    }

    /**
     * @param chrom sequence name used for the intervals
     * @param bases sequence bases
     * @return 0-based half-open intervals in increasing order, empty if no base is a target
     */
    public List<GenomicInterval> find(String chrom, byte[] bases) {
        List<GenomicInterval> regions = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i < bases.length; i++) {
            boolean target = targets[bases[i] & 0xFF];
            if (target && runStart < 0) {
                runStart = i;
            } else if (!target && runStart >= 0) {
                regions.add(new GenomicInterval(chrom, runStart, i));
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            regions.add(new GenomicInterval(chrom, runStart, bases.length));
        }
        return regions;
    }
}
