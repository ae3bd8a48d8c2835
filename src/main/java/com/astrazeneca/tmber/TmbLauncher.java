package com.astrazeneca.tmber;

import com.astrazeneca.tmber.exception.ConfigurationException;
import com.astrazeneca.tmber.external.*;
import com.astrazeneca.tmber.modes.AbstractMode;
import com.astrazeneca.tmber.modes.BedMode;
import com.astrazeneca.tmber.modes.TmbMode;
import com.astrazeneca.tmber.modules.VcfReader;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Class starts tmber for the current run
 */
public class TmbLauncher {
    private static final Log log = Log.getInstance(TmbLauncher.class);

    private final ExecutableLocator locator;

    public TmbLauncher() {
        this(new ExecutableLocator());
    }

    public TmbLauncher(ExecutableLocator locator) {
        this.locator = locator;
    }

    /**
     * Checks the configuration, initializes resources and runs the requested mode (tmb/bed).
     * @param config starting configuration
     * @throws IOException if inputs can't be read or outputs can't be written
     */
    public void start(Configuration config) throws IOException {
        logParameters(config);
        createMode(config).run();
    }

    AbstractMode createMode(Configuration config) {
        if (config.command == Configuration.Command.BED) {
            if (config.fasta == null) {
                throw new ConfigurationException("The FASTA file is missed.");
            }
            return new BedMode(config);
        }
        if (config.beds.isEmpty()) {
            throw new ConfigurationException("The required BED file missed, please, set it with -b option.");
        }
        if (config.vcfs.isEmpty()) {
            throw new ConfigurationException("The VCF file missed, please, set at least one VCF path.");
        }
        InputOpener opener = new InputOpener(config.externalDecompression, locator, config.threads);
        List<File> inputs = new ArrayList<>();
        for (String path : config.beds) {
            inputs.add(new File(path));
        }
        for (String path : config.vcfs) {
            inputs.add(new File(path));
        }
        opener.checkTools(inputs);

        RegionMerger merger = config.useBedtools
                ? new BedtoolsRegionMerger(locator.locate("bedtools"))
                : new IntervalListRegionMerger();
        VcfReader vcfReader = new VcfReader(opener, config.includeFiltered, config.sample, config.minAf, config.maxAf);
        return new TmbMode(config, new RegionSetBuilder(opener, merger), vcfReader);
    }

    private void logParameters(Configuration config) {
        log.info("command: ", config.command);
        log.info("threads: ", config.threads);
        log.info("dest dir: ", new File(config.destDir).getAbsolutePath());
        if (config.command == Configuration.Command.BED) {
            log.info("fasta: ", config.fasta);
            log.info("target letters: ", config.targetLetters, config.uppercase ? " (case-sensitive)" : "");
            log.info("human autosomes only: ", config.humanAutosome);
        } else {
            log.info("beds: ", config.beds);
            log.info("vcfs: ", config.vcfs);
            log.info("include filtered: ", config.includeFiltered);
            if (config.isAfFilterSet()) {
                log.info("AF window: [", config.minAf, ", ", config.maxAf, "] in sample ", config.sample);
            }
        }
    }
}
