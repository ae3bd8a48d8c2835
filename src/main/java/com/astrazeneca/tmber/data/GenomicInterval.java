package com.astrazeneca.tmber.data;


import java.util.Comparator;
import java.util.Objects;

/**
 * Class for holding one interval of a BED file. Coordinates are 0-based half-open.
 */
public class GenomicInterval {
    public static final Comparator<GenomicInterval> COORDINATE_COMPARATOR =
            Comparator.<GenomicInterval, String>comparing(i -> i.chrom)
                    .thenComparingInt(i -> i.start)
                    .thenComparingInt(i -> i.end);

    /**
     * Chromosome name
     */
    public final String chrom;

    /**
     * Interval start (0-based, inclusive)
     */
    public final int start;

    /**
     * Interval end (0-based, exclusive)
     */
    public final int end;

    public GenomicInterval(String chrom, int start, int end) {
        this.chrom = chrom;
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    /**
     * Containment of a 1-based closed variant span: the interval covers positions start + 1 .. end.
     * @param posStart first variant position
     * @param posEnd last variant position
     * @return true if the span lies inside this interval
     */
    public boolean contains(int posStart, int posEnd) {
        return start < posStart && end >= posEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenomicInterval interval = (GenomicInterval) o;
        return start == interval.start &&
                end == interval.end &&
                Objects.equals(chrom, interval.chrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chrom, start, end);
    }

    @Override
    public String toString() {
        return "GenomicInterval [chrom=" + chrom + ", start=" + start + ", end=" + end + "]";
    }

    public String printInterval() {
        return chrom + ":" + start + "-" + end;
    }
}
