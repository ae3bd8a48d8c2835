package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.RegionSet;
import com.astrazeneca.tmber.data.TallyResult;
import com.astrazeneca.tmber.data.VariantRecord;
import htsjdk.samtools.util.Log;

import java.util.*;

/**
 * Counts, for one region set, the variants contained in its intervals grouped by ref/alt pair.
 * A variant inside several intervals is counted once.
 */
public class OverlapTallyEngine {
    private static final Log log = Log.getInstance(OverlapTallyEngine.class);

    /**
     * @param variants variant records; duplicates are collapsed before counting
     * @param regionSet region set to count in
     * @return one result per ref/alt pair with at least one contained variant, ordered by ref and alt
     */
    public List<TallyResult> tally(Collection<VariantRecord> variants, RegionSet regionSet) {
        Collection<VariantRecord> unique = variants instanceof Set ? variants : new LinkedHashSet<>(variants);

        Map<String, Map<String, Long>> counts = new TreeMap<>();
        int contained = 0;
        for (VariantRecord variant : unique) {
            if (regionSet.contains(variant)) {
                counts.computeIfAbsent(variant.ref, r -> new TreeMap<>()).merge(variant.alt, 1L, Long::sum);
                contained++;
            }
        }

        List<TallyResult> results = new ArrayList<>();
        for (Map.Entry<String, Map<String, Long>> byRef : counts.entrySet()) {
            for (Map.Entry<String, Long> byAlt : byRef.getValue().entrySet()) {
                results.add(new TallyResult(regionSet.name, regionSet.size,
                        SequenceOntologyClassifier.classify(byRef.getKey(), byAlt.getKey()),
                        byRef.getKey(), byAlt.getKey(), byAlt.getValue()));
            }
        }
        log.debug(contained, " of ", unique.size(), " variants are in ", regionSet.name);
        return results;
    }
}
