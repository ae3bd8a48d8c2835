package com.astrazeneca.tmber.printers;

import com.astrazeneca.tmber.data.GenomicInterval;

import static com.astrazeneca.tmber.Utils.join;

/**
 * Row of a 3-column BED file: chrom, chromStart, chromEnd.
 */
public class BedOutputRow extends OutputRow {
    private final GenomicInterval interval;

    public BedOutputRow(GenomicInterval interval) {
        this.interval = interval;
    }

    @Override
    public String toString() {
        return join(delimiter, interval.chrom, interval.start, interval.end);
    }
}
