package com.astrazeneca.tmber.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns used by the parsers stored in one place.
 */
public class Patterns {
    public static final Pattern TAB = Pattern.compile("\t");
    public static final Pattern COLON = Pattern.compile(":");
    public static final Pattern SEMICOLON = Pattern.compile(";");
    public static final Pattern COMMA = Pattern.compile(",");

    public static final Pattern CHR_PREFIX = Pattern.compile("^(?i)chr");
    public static final Pattern INTEGER_ONLY = Pattern.compile("^-?\\d+$");

    //File name suffixes
    public static final Pattern COMPRESSION_SUFFIX = Pattern.compile("\\.(gz|bgz|bz2)$");
    public static final Pattern BED_SUFFIX = Pattern.compile("\\.bed$", Pattern.CASE_INSENSITIVE);
    public static final Pattern VCF_SUFFIX = Pattern.compile("\\.vcf$", Pattern.CASE_INSENSITIVE);
    public static final Pattern FASTA_SUFFIX = Pattern.compile("\\.(fa|fasta|fna)$", Pattern.CASE_INSENSITIVE);
}
