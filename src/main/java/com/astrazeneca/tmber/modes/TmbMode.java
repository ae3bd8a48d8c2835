package com.astrazeneca.tmber.modes;

import com.astrazeneca.tmber.Configuration;
import com.astrazeneca.tmber.RegionSetBuilder;
import com.astrazeneca.tmber.data.RegionSet;
import com.astrazeneca.tmber.data.TallyResult;
import com.astrazeneca.tmber.data.TmbRow;
import com.astrazeneca.tmber.data.VariantRecord;
import com.astrazeneca.tmber.exception.ConfigurationException;
import com.astrazeneca.tmber.modules.OverlapTallyEngine;
import com.astrazeneca.tmber.modules.TmbAggregator;
import com.astrazeneca.tmber.modules.VcfReader;
import com.astrazeneca.tmber.printers.TablePrinter;
import com.astrazeneca.tmber.printers.TallyOutputRow;
import com.astrazeneca.tmber.printers.TmbOutputRow;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import static com.astrazeneca.tmber.Utils.baseName;
import static com.astrazeneca.tmber.data.Patterns.VCF_SUFFIX;

/**
 * Mode computing TMB: region sets and VCF files are loaded in parallel, then for each VCF one tally task per
 * region set runs against the shared read-only variant set. Tables are written after every VCF was processed.
 */
public class TmbMode extends AbstractMode {
    private static final Log log = Log.getInstance(TmbMode.class);

    public static final String TALLY_SUFFIX = ".variant_counts.tsv";
    public static final String TMB_SUFFIX = ".tmb.tsv";

    private final RegionSetBuilder regionSetSource;
    private final VcfReader vcfReader;
    private final OverlapTallyEngine engine = new OverlapTallyEngine();
    private final TmbAggregator aggregator = new TmbAggregator();

    /**
     * @throws ConfigurationException if two VCF files would write to the same output files
     */
    public TmbMode(Configuration conf, RegionSetBuilder regionSetSource, VcfReader vcfReader) {
        super(conf);
        checkOutputNames(conf.vcfs);
        this.regionSetSource = regionSetSource;
        this.vcfReader = vcfReader;
    }

    /**
     * Output tables are named after the VCF stem, so stems must be unique within a run.
     * @param vcfs VCF paths
     */
    static void checkOutputNames(List<String> vcfs) {
        Map<String, String> stems = new HashMap<>();
        for (String vcf : vcfs) {
            String stem = baseName(new File(vcf), VCF_SUFFIX);
            String previous = stems.putIfAbsent(stem, vcf);
            if (previous != null) {
                throw new ConfigurationException("VCF files " + previous + " and " + vcf
                        + " would write the same output files " + stem + TALLY_SUFFIX + " and " + stem + TMB_SUFFIX
                        + ". Please, rename one of them.");
            }
        }
    }

    @Override
    public void run() throws IOException {
        List<RegionSet> regionSets = loadRegionSets();
        Map<File, Set<VariantRecord>> variants = loadVariants();

        Map<File, Tables> tables = new LinkedHashMap<>();
        for (Map.Entry<File, Set<VariantRecord>> entry : variants.entrySet()) {
            tables.put(entry.getKey(), computeTables(entry.getKey(), entry.getValue(), regionSets));
        }

        Path destDir = Paths.get(conf.destDir);
        Files.createDirectories(destDir);
        for (Map.Entry<File, Tables> entry : tables.entrySet()) {
            String stem = baseName(entry.getKey(), VCF_SUFFIX);
            Tables result = entry.getValue();
            List<TallyOutputRow> tallyRows = new ArrayList<>();
            for (TallyResult tally : result.tallies) {
                tallyRows.add(new TallyOutputRow(tally));
            }
            List<TmbOutputRow> tmbRows = new ArrayList<>();
            for (TmbRow row : result.rows) {
                tmbRows.add(new TmbOutputRow(row));
            }
            TablePrinter.writeTable(destDir.resolve(stem + TALLY_SUFFIX),
                    conf.printHeader ? TallyOutputRow.HEADER : null, tallyRows, false);
            TablePrinter.writeTable(destDir.resolve(stem + TMB_SUFFIX),
                    conf.printHeader ? TmbOutputRow.HEADER : null, tmbRows, false);
        }
    }

    List<RegionSet> loadRegionSets() {
        List<NamedTask<RegionSet>> tasks = new ArrayList<>();
        for (String bed : conf.beds) {
            File file = new File(bed);
            tasks.add(new NamedTask<>("region set " + bed, () -> regionSetSource.build(file)));
        }
        List<RegionSet> regionSets = dispatch(tasks);
        regionSets.sort(Comparator.comparing((RegionSet r) -> r.name).thenComparingLong(r -> r.size));
        return regionSets;
    }

    /**
     * @return variants of every VCF in the order the files were given
     */
    Map<File, Set<VariantRecord>> loadVariants() {
        List<NamedTask<Map.Entry<File, Set<VariantRecord>>>> tasks = new ArrayList<>();
        for (String vcf : conf.vcfs) {
            File file = new File(vcf);
            tasks.add(new NamedTask<>("VCF " + vcf,
                    () -> new AbstractMap.SimpleImmutableEntry<>(file, vcfReader.read(file))));
        }
        Map<File, Set<VariantRecord>> loaded = new HashMap<>();
        for (Map.Entry<File, Set<VariantRecord>> entry : dispatch(tasks)) {
            loaded.put(entry.getKey(), entry.getValue());
        }
        Map<File, Set<VariantRecord>> ordered = new LinkedHashMap<>();
        for (String vcf : conf.vcfs) {
            File file = new File(vcf);
            ordered.put(file, loaded.get(file));
        }
        return ordered;
    }

    Tables computeTables(File vcf, Set<VariantRecord> variants, List<RegionSet> regionSets) {
        log.info("Count variants of ", vcf, " in ", regionSets.size(), " region set(s)");
        List<NamedTask<List<TallyResult>>> tasks = new ArrayList<>();
        for (RegionSet regionSet : regionSets) {
            tasks.add(new NamedTask<>("tally of " + vcf + " in " + regionSet.name,
                    () -> engine.tally(variants, regionSet)));
        }
        List<TallyResult> tallies = new ArrayList<>();
        for (List<TallyResult> result : dispatch(tasks)) {
            tallies.addAll(result);
        }
        tallies.sort(TallyResult.OUTPUT_ORDER);
        return new Tables(tallies, aggregator.aggregate(tallies, regionSets));
    }

    static final class Tables {
        final List<TallyResult> tallies;
        final List<TmbRow> rows;

        Tables(List<TallyResult> tallies, List<TmbRow> rows) {
            this.tallies = tallies;
            this.rows = rows;
        }
    }
}
