package com.astrazeneca.tmber.data;

import java.util.Comparator;
import java.util.Objects;

/**
 * One line of the final TMB table: the observed count of a variant type in a region set and its rate per megabase.
 */
public class TmbRow {
    public static final String TOTAL = "total";

    public static final Comparator<TmbRow> OUTPUT_ORDER =
            Comparator.<TmbRow, String>comparing(r -> r.regionSetName)
                    .thenComparingLong(r -> r.regionSetSize)
                    .thenComparing(r -> r.variantType);

    public final String regionSetName;
    public final long regionSetSize;
    /**
     * Label of a {@link MutationClass} or {@link #TOTAL}
     */
    public final String variantType;
    public final long observedCount;
    public final double mutationsPerMb;

    public TmbRow(String regionSetName, long regionSetSize, String variantType, long observedCount) {
        this.regionSetName = regionSetName;
        this.regionSetSize = regionSetSize;
        this.variantType = variantType;
        this.observedCount = observedCount;
        this.mutationsPerMb = (double) observedCount / regionSetSize * 1_000_000;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TmbRow tmbRow = (TmbRow) o;
        return regionSetSize == tmbRow.regionSetSize &&
                observedCount == tmbRow.observedCount &&
                Objects.equals(regionSetName, tmbRow.regionSetName) &&
                Objects.equals(variantType, tmbRow.variantType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionSetName, regionSetSize, variantType, observedCount);
    }

    @Override
    public String toString() {
        return "TmbRow [regionSet=" + regionSetName + ", size=" + regionSetSize + ", type=" + variantType
                + ", count=" + observedCount + ", perMb=" + mutationsPerMb + "]";
    }
}
