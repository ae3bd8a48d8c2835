package com.astrazeneca.tmber;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Pattern;

import static com.astrazeneca.tmber.data.Patterns.CHR_PREFIX;
import static com.astrazeneca.tmber.data.Patterns.COMPRESSION_SUFFIX;

public final class Utils {
    private static final String CHR_LABEL = "chr";

    private Utils() {
    }

    /**
     * Method creates string from arguments by appending them with specified delimiter
     * @param delim specified delimiter
     * @param args array of arguments
     * @return generated string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    public static int toInt(String intStr) {
        return Integer.parseInt(intStr.trim());
    }

    /**
     * Strips any leading "chr" (in any case) and adds "chr" once, so "1", "chr1" and "CHR1" all become "chr1".
     * @param chrom chromosome name as written in the input
     * @return normalized chromosome name
     */
    public static String normalizeChromosome(String chrom) {
        return CHR_LABEL + CHR_PREFIX.matcher(chrom).replaceFirst("");
    }

    /**
     * Builds a name for outputs from the input file name: drops a compression suffix and then the format suffix.
     * @param file input file
     * @param formatSuffix suffix of the format, e.g. ".vcf"
     * @return base name of the file
     */
    public static String baseName(File file, Pattern formatSuffix) {
        String name = COMPRESSION_SUFFIX.matcher(file.getName()).replaceFirst("");
        return formatSuffix.matcher(name).replaceFirst("");
    }

    /**
     * Reads the project version from the bundled properties
     * @return version string or "unknown" if the resource is missing
     */
    public static String version() {
        Properties properties = new Properties();
        try (InputStream in = Utils.class.getResourceAsStream("/tmber.properties")) {
            if (in == null) {
                return "unknown";
            }
            properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return properties.getProperty("version", "unknown");
    }
}
