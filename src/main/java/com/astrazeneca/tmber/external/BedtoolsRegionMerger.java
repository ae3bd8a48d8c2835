package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.data.GenomicInterval;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static com.astrazeneca.tmber.Utils.toInt;
import static com.astrazeneca.tmber.data.Patterns.TAB;

/**
 * Merging with "bedtools merge". The intervals are sorted and written to a temporary BED first since
 * bedtools expects sorted input.
 */
public class BedtoolsRegionMerger implements RegionMerger {
    private static final Log log = Log.getInstance(BedtoolsRegionMerger.class);

    private final String bedtools;

    public BedtoolsRegionMerger(String bedtools) {
        this.bedtools = bedtools;
    }

    @Override
    public List<GenomicInterval> merge(List<GenomicInterval> intervals) throws IOException {
        List<GenomicInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(GenomicInterval.COORDINATE_COMPARATOR);

        File bed = File.createTempFile("tmber", ".bed");
        try {
            try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(bed.toPath(), StandardCharsets.UTF_8))) {
                for (GenomicInterval interval : sorted) {
                    writer.print(interval.chrom + "\t" + interval.start + "\t" + interval.end + "\n");
                }
            }
            log.debug("Merge ", sorted.size(), " intervals with ", bedtools);
            List<GenomicInterval> merged = new ArrayList<>();
            try (ExternalProcess process = new ExternalProcess(bedtools, "merge", "-i", bed.getPath())) {
                String line;
                while ((line = process.read()) != null) {
                    if (line.isEmpty()) {
                        continue;
                    }
                    String[] columns = TAB.split(line);
                    merged.add(new GenomicInterval(columns[0], toInt(columns[1]), toInt(columns[2])));
                }
            }
            return merged;
        } finally {
            Files.deleteIfExists(bed.toPath());
        }
    }
}
