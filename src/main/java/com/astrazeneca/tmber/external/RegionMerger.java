package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.data.GenomicInterval;

import java.io.IOException;
import java.util.List;

/**
 * Coalesces overlapping and book-ended intervals.
 */
public interface RegionMerger {
    /**
     * @param intervals 0-based half-open intervals with normalized chromosome names, in any order
     * @return merged intervals sorted by chromosome name and start
     * @throws IOException if an external merging tool fails
     */
    List<GenomicInterval> merge(List<GenomicInterval> intervals) throws IOException;
}
