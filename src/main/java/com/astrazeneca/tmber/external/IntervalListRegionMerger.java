package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.data.GenomicInterval;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.util.Interval;
import htsjdk.samtools.util.IntervalList;

import java.util.*;

/**
 * In-process merging with htsjdk {@link IntervalList#uniqued()}. The sequence dictionary is built from the
 * chromosome names in lexicographic order so the merged list comes out sorted by name, like "sort -k1,1" does.
 */
public class IntervalListRegionMerger implements RegionMerger {

    @Override
    public List<GenomicInterval> merge(List<GenomicInterval> intervals) {
        if (intervals.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, Integer> maxEnds = new TreeMap<>();
        for (GenomicInterval interval : intervals) {
            maxEnds.merge(interval.chrom, Math.max(interval.end, 1), Math::max);
        }
        List<SAMSequenceRecord> records = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : maxEnds.entrySet()) {
            records.add(new SAMSequenceRecord(entry.getKey(), entry.getValue()));
        }
        SAMFileHeader header = new SAMFileHeader();
        header.setSequenceDictionary(new SAMSequenceDictionary(records));

        IntervalList list = new IntervalList(header);
        for (GenomicInterval interval : intervals) {
            // zero-length BED intervals cover no base and have no 1-based closed form
            if (interval.length() > 0) {
                list.add(new Interval(interval.chrom, interval.start + 1, interval.end));
            }
        }

        List<GenomicInterval> merged = new ArrayList<>();
        for (Interval interval : list.uniqued(false).getIntervals()) {
            merged.add(new GenomicInterval(interval.getContig(), interval.getStart() - 1, interval.getEnd()));
        }
        return merged;
    }
}
