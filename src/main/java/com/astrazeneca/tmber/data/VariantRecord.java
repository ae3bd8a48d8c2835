package com.astrazeneca.tmber.data;

import java.util.Objects;

/**
 * One variant call from a VCF file. Positions are 1-based and the span [start, end] is closed.
 * Equality covers all five fields so that duplicated VCF lines collapse in a set.
 */
public class VariantRecord {
    /**
     * Chromosome name, always with the "chr" prefix
     */
    public final String chrom;

    /**
     * Position as read from the POS column
     */
    public final int start;

    /**
     * Last position covered by the variant, null when a symbolic allele has no usable END
     */
    public final Integer end;

    public final String ref;
    public final String alt;

    public VariantRecord(String chrom, int start, Integer end, String ref, String alt) {
        this.chrom = chrom;
        this.start = start;
        this.end = end;
        this.ref = ref;
        this.alt = alt;
    }

    public boolean hasResolvedEnd() {
        return end != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariantRecord that = (VariantRecord) o;
        return start == that.start &&
                Objects.equals(end, that.end) &&
                Objects.equals(chrom, that.chrom) &&
                Objects.equals(ref, that.ref) &&
                Objects.equals(alt, that.alt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chrom, start, end, ref, alt);
    }

    @Override
    public String toString() {
        return "VariantRecord [chrom=" + chrom + ", start=" + start + ", end=" + end
                + ", ref=" + ref + ", alt=" + alt + "]";
    }
}
