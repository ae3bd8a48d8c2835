package com.astrazeneca.tmber.data;

import java.util.Comparator;
import java.util.Objects;

/**
 * Count of contained variants with one ref/alt pair in one region set.
 */
public class TallyResult {
    public static final Comparator<TallyResult> OUTPUT_ORDER =
            Comparator.<TallyResult, String>comparing(t -> t.regionSetName)
                    .thenComparingLong(t -> t.regionSetSize)
                    .thenComparing(t -> t.mutationClass.label())
                    .thenComparing(t -> t.ref)
                    .thenComparing(t -> t.alt);

    public final String regionSetName;
    public final long regionSetSize;
    public final MutationClass mutationClass;
    public final String ref;
    public final String alt;
    public final long observedCount;

    public TallyResult(String regionSetName, long regionSetSize, MutationClass mutationClass,
                       String ref, String alt, long observedCount) {
        this.regionSetName = regionSetName;
        this.regionSetSize = regionSetSize;
        this.mutationClass = mutationClass;
        this.ref = ref;
        this.alt = alt;
        this.observedCount = observedCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TallyResult that = (TallyResult) o;
        return regionSetSize == that.regionSetSize &&
                observedCount == that.observedCount &&
                Objects.equals(regionSetName, that.regionSetName) &&
                mutationClass == that.mutationClass &&
                Objects.equals(ref, that.ref) &&
                Objects.equals(alt, that.alt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionSetName, regionSetSize, mutationClass, ref, alt, observedCount);
    }

    @Override
    public String toString() {
        return "TallyResult [regionSet=" + regionSetName + ", size=" + regionSetSize + ", class="
                + mutationClass.label() + ", ref=" + ref + ", alt=" + alt + ", count=" + observedCount + "]";
    }
}
