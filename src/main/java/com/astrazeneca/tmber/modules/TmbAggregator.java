package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.MutationClass;
import com.astrazeneca.tmber.data.RegionSet;
import com.astrazeneca.tmber.data.TallyResult;
import com.astrazeneca.tmber.data.TmbRow;

import java.util.*;

/**
 * Folds tally results into the TMB table: one row per region set and mutation class (zero for classes that were
 * not observed) plus a "total" row that leaves out no_sequence_alteration.
 */
public class TmbAggregator {

    /**
     * @param tallies tally results of all region sets
     * @param regionSets region sets the tallies were computed for; sets without any tally still get zero rows
     * @return rows sorted by region set name, size and variant type
     */
    public List<TmbRow> aggregate(Collection<TallyResult> tallies, Collection<RegionSet> regionSets) {
        Map<RegionKey, Map<MutationClass, Long>> counts = new HashMap<>();
        for (RegionSet regionSet : regionSets) {
            counts.computeIfAbsent(new RegionKey(regionSet.name, regionSet.size), k -> new EnumMap<>(MutationClass.class));
        }
        for (TallyResult tally : tallies) {
            counts.computeIfAbsent(new RegionKey(tally.regionSetName, tally.regionSetSize),
                    k -> new EnumMap<>(MutationClass.class))
                    .merge(tally.mutationClass, tally.observedCount, Long::sum);
        }

        List<TmbRow> rows = new ArrayList<>();
        for (Map.Entry<RegionKey, Map<MutationClass, Long>> entry : counts.entrySet()) {
            RegionKey key = entry.getKey();
            Map<MutationClass, Long> observed = entry.getValue();
            long total = 0;
            for (MutationClass mutationClass : MutationClass.values()) {
                Long count = observed.get(mutationClass);
                if (count == null && !mutationClass.isReportedWhenAbsent()) {
                    continue;
                }
                long value = count == null ? 0 : count;
                rows.add(new TmbRow(key.name, key.size, mutationClass.label(), value));
                if (mutationClass.countsTowardTotal()) {
                    total += value;
                }
            }
            rows.add(new TmbRow(key.name, key.size, TmbRow.TOTAL, total));
        }
        rows.sort(TmbRow.OUTPUT_ORDER);
        return rows;
    }

    private static class RegionKey {
        final String name;
        final long size;

        RegionKey(String name, long size) {
            this.name = name;
            this.size = size;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RegionKey that = (RegionKey) o;
            return size == that.size && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, size);
        }
    }
}
