package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.VariantRecord;

import static com.astrazeneca.tmber.Utils.normalizeChromosome;
import static com.astrazeneca.tmber.data.Patterns.COLON;
import static com.astrazeneca.tmber.data.Patterns.COMMA;
import static com.astrazeneca.tmber.data.Patterns.INTEGER_ONLY;
import static com.astrazeneca.tmber.data.Patterns.SEMICOLON;

/**
 * Builds {@link VariantRecord}s from VCF fields and reads per-sample values.
 */
public final class VariantRecordParser {
    private static final String END_KEY = "END=";
    private static final String AF_KEY = "AF";

    private VariantRecordParser() {
    }

    /**
     * @param chrom CHROM column, normalized to the "chr" form
     * @param pos POS column (1-based)
     * @param ref REF column
     * @param alt ALT column
     * @param info INFO column, used for END of symbolic alleles
     * @return variant record
     */
    public static VariantRecord toRecord(String chrom, int pos, String ref, String alt, String info) {
        return new VariantRecord(normalizeChromosome(chrom), pos, resolveEnd(pos, ref, alt, info), ref, alt);
    }

    /**
     * Last position of the variant. Symbolic alleles take END from INFO, the rest cover the REF allele.
     * @return end position or null if a symbolic allele has no integer END
     */
    public static Integer resolveEnd(int pos, String ref, String alt, String info) {
        if (alt.startsWith("<")) {
            return endFromInfo(info);
        }
        return pos + ref.length() - 1;
    }

    static Integer endFromInfo(String info) {
        if (info == null) {
            return null;
        }
        for (String field : SEMICOLON.split(info)) {
            if (field.startsWith(END_KEY)) {
                String value = field.substring(END_KEY.length());
                if (!INTEGER_ONLY.matcher(value).matches()) {
                    return null;
                }
                try {
                    return Integer.valueOf(value);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Zips FORMAT keys with the sample values and reads AF. For multi-allelic records the first value is used.
     * @param format FORMAT column
     * @param sampleValue column of the sample
     * @return allele frequency or null if AF is absent, not a number or not finite
     */
    public static Double extractAf(String format, String sampleValue) {
        if (format == null || sampleValue == null) {
            return null;
        }
        String[] keys = COLON.split(format);
        String[] values = COLON.split(sampleValue);
        for (int i = 0; i < keys.length && i < values.length; i++) {
            if (AF_KEY.equals(keys[i])) {
                String first = COMMA.split(values[i])[0];
                Double af;
                try {
                    af = Double.valueOf(first);
                } catch (NumberFormatException e) {
                    return null;
                }
                return af.isNaN() || af.isInfinite() ? null : af;
            }
        }
        return null;
    }

    public static boolean isPassing(String filter) {
        return "PASS".equals(filter) || ".".equals(filter);
    }
}
