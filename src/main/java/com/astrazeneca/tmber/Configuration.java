package com.astrazeneca.tmber;

import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.List;

public class Configuration {
    public static final String DEFAULT_TARGET_LETTERS = "ACGT";

    public enum Command {
        TMB, BED
    }

    public Command command;

    /**
     * Log level: --debug, --info or WARNING by default
     */
    public Log.LogLevel logLevel = Log.LogLevel.WARNING;

    /**
     * Directory for the output files
     */
    public String destDir = "."; // -d
    /**
     * Threads count
     */
    public int threads = 1; // -th
    /**
     * Print a header row describing columns
     */
    public boolean printHeader; // -h

    // tmb command
    /**
     * Paths to BED files with region sets
     */
    public List<String> beds = new ArrayList<>(); // -b
    /**
     * Paths to VCF files
     */
    public List<String> vcfs = new ArrayList<>();
    /**
     * Keep records whose FILTER is neither PASS nor "."
     */
    public boolean includeFiltered; // --include-filtered
    /**
     * Sample column to read AF from
     */
    public String sample; // --sample
    public Double minAf; // --min-af
    public Double maxAf; // --max-af
    /**
     * Merge regions with "bedtools merge" instead of in-process merging
     */
    public boolean useBedtools; // --bedtools
    /**
     * Decompress inputs with bgzip/pigz/pbzip2/bzip2 found in PATH
     */
    public boolean externalDecompression; // --external-decompression

    // bed command
    /**
     * Path to genome FASTA
     */
    public String fasta;
    public String targetLetters = DEFAULT_TARGET_LETTERS; // --target-letters
    /**
     * Match target letters only as given, soft-masked lowercase bases are skipped
     */
    public boolean uppercase; // --uppercase
    /**
     * Keep only chr1..chr22
     */
    public boolean humanAutosome; // --human-autosome
    /**
     * Write BGZF compressed BED
     */
    public boolean compress; // --compress

    public boolean isAfFilterSet() {
        return minAf != null || maxAf != null;
    }
}
