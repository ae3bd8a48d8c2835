package com.astrazeneca.tmber.data;

import com.astrazeneca.tmber.exception.EmptyRegionSetException;

import java.util.*;

/**
 * Named set of sorted, non-overlapping intervals. The intervals of each chromosome are kept in parallel
 * start/end arrays so a variant span can be looked up by binary search.
 */
public class RegionSet {
    public final String name;
    public final long size;

    private final List<GenomicInterval> intervals;
    private final Map<String, ChromosomeIntervals> byChromosome = new HashMap<>();

    /**
     * @param name region set name, usually derived from the BED file name
     * @param intervals merged intervals sorted by chromosome and start
     * @throws EmptyRegionSetException if there are no intervals or they cover no bases
     * @throws IllegalArgumentException if the intervals are unsorted or overlap
     */
    public RegionSet(String name, List<GenomicInterval> intervals) {
        this.name = name;
        if (intervals.isEmpty()) {
            throw new EmptyRegionSetException(name, "it contains no intervals");
        }
        long total = 0;
        GenomicInterval previous = null;
        Map<String, List<GenomicInterval>> grouped = new LinkedHashMap<>();
        for (GenomicInterval interval : intervals) {
            if (interval.end < interval.start) {
                throw new IllegalArgumentException("Interval end is before its start: " + interval.printInterval());
            }
            if (previous != null) {
                int order = previous.chrom.compareTo(interval.chrom);
                if (order > 0 || (order == 0 && previous.end > interval.start)) {
                    throw new IllegalArgumentException("Intervals of region set " + name
                            + " are not sorted and merged: " + previous.printInterval()
                            + " precedes " + interval.printInterval());
                }
            }
            total += interval.length();
            grouped.computeIfAbsent(interval.chrom, c -> new ArrayList<>()).add(interval);
            previous = interval;
        }
        if (total == 0) {
            throw new EmptyRegionSetException(name, "its total size is 0");
        }
        this.size = total;
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
        for (Map.Entry<String, List<GenomicInterval>> entry : grouped.entrySet()) {
            byChromosome.put(entry.getKey(), new ChromosomeIntervals(entry.getValue()));
        }
    }

    public List<GenomicInterval> getIntervals() {
        return intervals;
    }

    /**
     * Checks whether the variant lies inside at least one interval. Variants without a resolved end never match.
     * @param variant variant to look up
     * @return true if some interval has start &lt; variant start and end &gt;= variant end
     */
    public boolean contains(VariantRecord variant) {
        if (!variant.hasResolvedEnd()) {
            return false;
        }
        ChromosomeIntervals chromosomeIntervals = byChromosome.get(variant.chrom);
        return chromosomeIntervals != null && chromosomeIntervals.contains(variant.start, variant.end);
    }

    @Override
    public String toString() {
        return "RegionSet [name=" + name + ", intervals=" + intervals.size() + ", size=" + size + "]";
    }

    private static class ChromosomeIntervals {
        private final int[] starts;
        private final int[] ends;

        ChromosomeIntervals(List<GenomicInterval> intervals) {
            starts = new int[intervals.size()];
            ends = new int[intervals.size()];
            for (int i = 0; i < intervals.size(); i++) {
                starts[i] = intervals.get(i).start;
                ends[i] = intervals.get(i).end;
            }
        }

        /**
         * Intervals are disjoint and sorted, so ends grow with starts: among all intervals starting before
         * posStart the last one has the greatest end and is the only candidate to check.
         */
        boolean contains(int posStart, int posEnd) {
            int low = 0;
            int high = starts.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (starts[mid] < posStart) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            int candidate = low - 1;
            return candidate >= 0 && ends[candidate] >= posEnd;
        }
    }
}
