package com.astrazeneca.tmber.printers;

import com.astrazeneca.tmber.data.TmbRow;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.tmber.Utils.join;

/**
 * Row of the TMB table: bed_name, bed_size, variant_type, observed_count, mutations_per_mb.
 */
public class TmbOutputRow extends OutputRow {
    public static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
            "bed_name", "bed_size", "variant_type", "observed_count", "mutations_per_mb"));

    private final TmbRow row;

    public TmbOutputRow(TmbRow row) {
        this.row = row;
    }

    @Override
    public String toString() {
        return join(delimiter,
                row.regionSetName,
                row.regionSetSize,
                row.variantType,
                row.observedCount,
                Double.toString(row.mutationsPerMb));
    }
}
