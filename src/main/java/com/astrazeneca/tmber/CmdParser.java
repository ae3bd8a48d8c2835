package com.astrazeneca.tmber;

import htsjdk.samtools.util.Log;
import org.apache.commons.cli.*;

import java.io.PrintWriter;
import java.util.Arrays;

import static com.astrazeneca.tmber.data.Patterns.COMMA;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    static final String TMB = "tmb";
    static final String BED = "bed";

    private final PrintWriter helpOut;

    public CmdParser() {
        this(new PrintWriter(System.out, true));
    }

    CmdParser(PrintWriter helpOut) {
        this.helpOut = helpOut;
    }

    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line: the command (tmb or bed) followed by its options and arguments
     * @return configuration with parameters from command line or null if only help or version was requested
     * @throws ParseException if the command line can't be parsed or misses required arguments
     */
    public Configuration parseParams(String[] args) throws ParseException {
        if (args.length == 0 || isHelp(args[0])) {
            help(null);
            return null;
        }
        if ("--version".equals(args[0])) {
            helpOut.println("tmber " + Utils.version());
            return null;
        }
        String command = args[0];
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        Options options;
        switch (command) {
            case TMB:
                options = buildTmbOptions();
                break;
            case BED:
                options = buildBedOptions();
                break;
            default:
                help(null);
                throw new ParseException("Unknown command: " + command + ". Use one of: " + TMB + ", " + BED);
        }

        for (String arg : rest) {
            if (isHelp(arg)) {
                help(command);
                return null;
            }
        }
        try {
            CommandLine cmd = new DefaultParser().parse(options, rest);
            if (cmd.hasOption("version")) {
                helpOut.println("tmber " + Utils.version());
                return null;
            }
            Configuration config = parseCommon(cmd);
            if (TMB.equals(command)) {
                parseTmb(cmd, config);
            } else {
                parseBed(cmd, config);
            }
            return config;
        } catch (ParseException e) {
            help(command);
            throw e;
        }
    }

    private Configuration parseCommon(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();
        if (cmd.hasOption("debug")) {
            config.logLevel = Log.LogLevel.DEBUG;
        } else if (cmd.hasOption("info")) {
            config.logLevel = Log.LogLevel.INFO;
        }
        config.destDir = cmd.getOptionValue("d", ".");
        config.threads = Math.max(readThreadsCount(cmd), 1);
        return config;
    }

    /**
     * For each parameter of the tmb command set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @param config configuration to fill
     * @throws ParseException if values can't be parsed or VCF paths are missing
     */
    private void parseTmb(CommandLine cmd, Configuration config) throws ParseException {
        config.command = Configuration.Command.TMB;
        for (String value : cmd.getOptionValues("b")) {
            for (String bed : COMMA.split(value)) {
                if (!bed.isEmpty()) {
                    config.beds.add(bed);
                }
            }
        }
        config.vcfs.addAll(cmd.getArgList());
        if (config.vcfs.isEmpty()) {
            throw new ParseException("Missing VCF path(s)");
        }
        config.printHeader = cmd.hasOption("h");
        config.includeFiltered = cmd.hasOption("include-filtered");
        config.sample = cmd.getOptionValue("sample");
        config.minAf = getDoubleValue(cmd, "min-af");
        config.maxAf = getDoubleValue(cmd, "max-af");
        if (config.isAfFilterSet() && config.sample == null) {
            throw new ParseException("--min-af/--max-af require --sample");
        }
        config.useBedtools = cmd.hasOption("bedtools");
        config.externalDecompression = cmd.hasOption("external-decompression");
    }

    /**
     * For each parameter of the bed command set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @param config configuration to fill
     * @throws ParseException if the FASTA path is missing
     */
    private void parseBed(CommandLine cmd, Configuration config) throws ParseException {
        config.command = Configuration.Command.BED;
        String[] args = cmd.getArgs();
        if (args.length != 1) {
            throw new ParseException("Exactly one FASTA path is expected");
        }
        config.fasta = args[0];
        config.targetLetters = cmd.getOptionValue("target-letters", Configuration.DEFAULT_TARGET_LETTERS);
        if (config.targetLetters.isEmpty()) {
            throw new ParseException("--target-letters can't be empty");
        }
        config.uppercase = cmd.hasOption("uppercase");
        config.humanAutosome = cmd.hasOption("human-autosome");
        config.compress = cmd.hasOption("compress");
    }

    /**
     * Options shared by the commands
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    private Options buildCommonOptions() {
        Options options = new Options();
        options.addOption("H", "help", false, "Print this help page");
        options.addOption(OptionBuilder.withLongOpt("version")
                .withDescription("Print version and exit")
                .create());
        options.addOption(OptionBuilder.withLongOpt("debug")
                .withDescription("Execute a command with debug messages")
                .create());
        options.addOption(OptionBuilder.withLongOpt("info")
                .withDescription("Execute a command with info messages")
                .create());

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Limit CPU cores to use. Default: number of available processors.")
                .withType(Number.class)
                .isRequired(false)
                .withLongOpt("cpus")
                .create("th"));

        options.addOption(OptionBuilder.withArgName("path")
                .hasArg(true)
                .withDescription("Directory for the output files. Default: .")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("dest-dir")
                .create('d'));
        return options;
    }

    @SuppressWarnings("static-access")
    private Options buildTmbOptions() {
        Options options = buildCommonOptions();
        options.addOption("h", "header", false, "Print a header row describing columns");
        options.addOption(OptionBuilder.withLongOpt("include-filtered")
                .withDescription("Include filtered variants (FILTER other than PASS or .)")
                .create());
        options.addOption(OptionBuilder.withLongOpt("bedtools")
                .withDescription("Merge BED intervals with bedtools from PATH")
                .create());
        options.addOption(OptionBuilder.withLongOpt("external-decompression")
                .withDescription("Decompress inputs with bgzip/pigz or pbzip2/bzip2 from PATH")
                .create());

        options.addOption(OptionBuilder.withArgName("path")
                .hasArg(true)
                .withDescription("BED file with a region set. Can be repeated or comma separated")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("bed")
                .create('b'));

        options.addOption(OptionBuilder.withArgName("name")
                .hasArg(true)
                .withDescription("Sample column to read AF (FORMAT field) from")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("sample")
                .create());

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("Minimum allele frequency (inclusive). Requires --sample")
                .withType(Number.class)
                .isRequired(false)
                .withLongOpt("min-af")
                .create());

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("Maximum allele frequency (inclusive). Requires --sample")
                .withType(Number.class)
                .isRequired(false)
                .withLongOpt("max-af")
                .create());
        return options;
    }

    @SuppressWarnings("static-access")
    private Options buildBedOptions() {
        Options options = buildCommonOptions();
        options.addOption(OptionBuilder.withLongOpt("human-autosome")
                .withDescription("Extract only human autosomes (chr1-22)")
                .create());
        options.addOption(OptionBuilder.withLongOpt("uppercase")
                .withDescription("Match the target letters only as given, skip soft-masked bases")
                .create());
        options.addOption(OptionBuilder.withLongOpt("compress")
                .withDescription("Write a BGZF compressed BED (.bed.gz)")
                .create());

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("Nucleic acid codes to include. Default: ACGT")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("target-letters")
                .create());
        return options;
    }

    private Double getDoubleValue(CommandLine cmd, String opt) throws ParseException {
        Object value = cmd.getParsedOptionValue(opt);
        return value == null ? null : ((Number) value).doubleValue();
    }

    /**
     * Calculates possible count of threads to use. If -th is not set, it will be set to number of available
     * processors.
     * @param cmd parsed CommandLine from apache CLI
     * @return number of threads
     * @throws ParseException if option -th can't be read
     */
    private int readThreadsCount(CommandLine cmd) throws ParseException {
        Object value = cmd.getParsedOptionValue("th");
        if (value == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        return ((Number) value).intValue();
    }

    private static boolean isHelp(String arg) {
        return "-H".equals(arg) || "--help".equals(arg);
    }

    private void help(String command) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(null);
        String description = "Tumor Mutational Burden Analyzer\n"
                + "  tmb   Calculate variant counts and mutations per megabase on BED regions\n"
                + "  bed   Identify regions consisting of target letters in FASTA\nOptions:";
        if (command == null || TMB.equals(command)) {
            formatter.printHelp(helpOut, 120, "tmber tmb [options] -b <bed_path> <vcf_path>...",
                    description, buildTmbOptions(), 2, 4, "");
        }
        if (command == null || BED.equals(command)) {
            formatter.printHelp(helpOut, 120, "tmber bed [options] <fa_path>",
                    command == null ? "Options:" : description, buildBedOptions(), 2, 4, "");
        }
        helpOut.flush();
    }
}
