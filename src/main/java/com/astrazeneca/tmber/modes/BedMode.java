package com.astrazeneca.tmber.modes;

import com.astrazeneca.tmber.Configuration;
import com.astrazeneca.tmber.data.GenomicInterval;
import com.astrazeneca.tmber.modules.TargetRegionFinder;
import com.astrazeneca.tmber.printers.BedOutputRow;
import com.astrazeneca.tmber.printers.TablePrinter;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import static com.astrazeneca.tmber.Utils.baseName;
import static com.astrazeneca.tmber.Utils.normalizeChromosome;
import static com.astrazeneca.tmber.data.Patterns.FASTA_SUFFIX;

/**
 * Mode deriving a region-of-interest BED from a genome FASTA: every maximal run of target letters becomes one
 * interval. Each sequence is scanned by its own task.
 */
public class BedMode extends AbstractMode {
    private static final Log log = Log.getInstance(BedMode.class);

    static final Set<String> HUMAN_AUTOSOMES;

    static {
        Set<String> autosomes = new HashSet<>();
        for (int i = 1; i <= 22; i++) {
            autosomes.add("chr" + i);
        }
        HUMAN_AUTOSOMES = Collections.unmodifiableSet(autosomes);
    }

    public BedMode(Configuration conf) {
        super(conf);
    }

    @Override
    public void run() throws IOException {
        File fasta = new File(conf.fasta);
        List<GenomicInterval> regions = findRegions(fasta);

        Path destDir = Paths.get(conf.destDir);
        Files.createDirectories(destDir);
        Path bed = destDir.resolve(baseName(fasta, FASTA_SUFFIX) + (conf.compress ? ".bed.gz" : ".bed"));
        List<BedOutputRow> rows = new ArrayList<>(regions.size());
        for (GenomicInterval region : regions) {
            rows.add(new BedOutputRow(region));
        }
        TablePrinter.writeTable(bed, null, rows, conf.compress);
    }

    /**
     * @param fasta genome FASTA, plain or gzipped
     * @return target regions sorted by chromosome, start and end
     * @throws IOException if the FASTA can't be read
     */
    List<GenomicInterval> findRegions(File fasta) throws IOException {
        TargetRegionFinder finder = new TargetRegionFinder(conf.targetLetters, conf.uppercase);
        List<NamedTask<List<GenomicInterval>>> tasks = new ArrayList<>();
        try (ReferenceSequenceFile reference =
                     ReferenceSequenceFileFactory.getReferenceSequenceFile(fasta.toPath(), true, false)) {
            ReferenceSequence sequence;
            while ((sequence = reference.nextSequence()) != null) {
                String name = sequence.getName();
                if (conf.humanAutosome && !HUMAN_AUTOSOMES.contains(normalizeChromosome(name))) {
                    log.debug("Skip a non-autosome sequence: ", name);
                    continue;
                }
                byte[] bases = sequence.getBases();
                tasks.add(new NamedTask<>("sequence " + name, () -> {
                    List<GenomicInterval> found = finder.find(name, bases);
                    if (found.isEmpty()) {
                        log.info("No region to extract: ", name);
                    } else {
                        log.info("Identify regions to extract: ", name);
                    }
                    return found;
                }));
            }
        }
        List<GenomicInterval> regions = new ArrayList<>();
        for (List<GenomicInterval> found : dispatch(tasks)) {
            regions.addAll(found);
        }
        regions.sort(GenomicInterval.COORDINATE_COMPARATOR);
        return regions;
    }
}
