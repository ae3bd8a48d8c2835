package com.astrazeneca.tmber.printers;

import com.astrazeneca.tmber.data.TallyResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.tmber.Utils.join;

/**
 * Row of the raw tally table: bed_name, bed_size, variant_type, ref, alt, observed_count.
 */
public class TallyOutputRow extends OutputRow {
    public static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
            "bed_name", "bed_size", "variant_type", "ref", "alt", "observed_count"));

    private final TallyResult tally;

    public TallyOutputRow(TallyResult tally) {
        this.tally = tally;
    }

    @Override
    public String toString() {
        return join(delimiter,
                tally.regionSetName,
                tally.regionSetSize,
                tally.mutationClass.label(),
                tally.ref,
                tally.alt,
                tally.observedCount);
    }
}
