package com.astrazeneca.tmber;

import com.astrazeneca.tmber.data.GenomicInterval;
import com.astrazeneca.tmber.data.RegionSet;
import com.astrazeneca.tmber.exception.InputFormatException;
import com.astrazeneca.tmber.external.InputOpener;
import com.astrazeneca.tmber.external.LineReader;
import com.astrazeneca.tmber.external.RegionMerger;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.astrazeneca.tmber.Utils.baseName;
import static com.astrazeneca.tmber.Utils.normalizeChromosome;
import static com.astrazeneca.tmber.Utils.toInt;
import static com.astrazeneca.tmber.data.Patterns.BED_SUFFIX;
import static com.astrazeneca.tmber.data.Patterns.TAB;

/**
 * Build region sets from BED files: chromosome names are normalized to the "chr" form, then the intervals are merged.
 */
public class RegionSetBuilder {
    private static final Log log = Log.getInstance(RegionSetBuilder.class);

    private final InputOpener opener;
    private final RegionMerger merger;

    public RegionSetBuilder(InputOpener opener, RegionMerger merger) {
        this.opener = opener;
        this.merger = merger;
    }

    /**
     * @param bed BED file, plain or compressed
     * @return region set named after the file
     * @throws IOException if the file can't be read or the merging tool fails
     */
    public RegionSet build(File bed) throws IOException {
        List<GenomicInterval> intervals = readIntervals(bed);
        List<GenomicInterval> merged = merger.merge(intervals);
        RegionSet regionSet = new RegionSet(baseName(bed, BED_SUFFIX), merged);
        log.info("Region set ", regionSet.name, ": ", intervals.size(), " BED lines merged into ",
                merged.size(), " intervals, ", regionSet.size, " bp");
        return regionSet;
    }

    /**
     * Method reads BED file line by line, skipping comments and browser/track lines.
     * @param bed BED file
     * @return intervals with normalized chromosome names in file order
     * @throws IOException if the file can't be read
     */
    List<GenomicInterval> readIntervals(File bed) throws IOException {
        List<GenomicInterval> intervals = new ArrayList<>();
        try (LineReader reader = opener.open(bed)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.read()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()
                        || line.startsWith("#")
                        || line.startsWith("browser")
                        || line.startsWith("track")) {
                    continue;
                }
                intervals.add(parseLine(line, bed.getPath(), lineNumber));
            }
        }
        return intervals;
    }

    GenomicInterval parseLine(String line, String source, int lineNumber) {
        String[] columnValues = TAB.split(line);
        if (columnValues.length < 3) {
            throw new InputFormatException(source, lineNumber, "expected at least 3 columns");
        }
        int start;
        int end;
        try {
            start = toInt(columnValues[1]);
            end = toInt(columnValues[2]);
        } catch (NumberFormatException e) {
            throw new InputFormatException(source, lineNumber,
                    "2 and 3 columns must contain region start and end", e);
        }
        if (start < 0 || start > end) {
            throw new InputFormatException(source, lineNumber, "wrong region boundaries " + start + "-" + end);
        }
        return new GenomicInterval(normalizeChromosome(columnValues[0]), start, end);
    }
}
