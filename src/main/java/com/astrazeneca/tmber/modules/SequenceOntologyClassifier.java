package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.MutationClass;

import static com.astrazeneca.tmber.data.MutationClass.*;

/**
 * Labels an allele pair with a sequence ontology term. Rules are checked in order and the first match wins:
 * breakends, symbolic alleles, "." and "*", then the lengths of REF and the first ALT allele.
 */
public final class SequenceOntologyClassifier {

    private SequenceOntologyClassifier() {
    }

    /**
     * @param ref reference allele
     * @param alt alternate allele(s), comma separated
     * @return mutation class, {@link MutationClass#UNCLASSIFIED} if no rule matches
     */
    public static MutationClass classify(String ref, String alt) {
        if (alt.contains("[") || alt.contains("]")) {
            return STRUCTURAL_VARIANT;
        } else if (isSymbolic(alt, "DEL")) {
            return DELETION;
        } else if (isSymbolic(alt, "INS")) {
            return INSERTION;
        } else if (isSymbolic(alt, "DUP")) {
            return DUPLICATION;
        } else if (isSymbolic(alt, "INV")) {
            return INVERSION;
        } else if (isSymbolic(alt, "CNV")) {
            return COPY_NUMBER_VARIATION;
        } else if (alt.equals(".")) {
            return NO_SEQUENCE_ALTERATION;
        } else if (alt.equals("*")) {
            return DELETION;
        }

        int comma = alt.indexOf(',');
        String alt0 = comma < 0 ? alt : alt.substring(0, comma);
        int refLength = ref.length();
        int altLength = alt0.length();
        if (refLength == 1 && altLength == 1) {
            return SNV;
        }
        boolean sameFirstBase = refLength > 0 && altLength > 0 && ref.charAt(0) == alt0.charAt(0);
        if (sameFirstBase && refLength > 1 && altLength == 1) {
            return DELETION;
        } else if (sameFirstBase && refLength == 1 && altLength > 1) {
            return INSERTION;
        } else if (refLength > 1 && altLength > 1) {
            return DELINS;
        }
        return UNCLASSIFIED;
    }

    /**
     * Matches "&lt;TYPE&gt;" and subtypes such as "&lt;DEL:ME&gt;"
     */
    private static boolean isSymbolic(String alt, String type) {
        return alt.startsWith("<" + type + ">") || alt.startsWith("<" + type + ":");
    }
}
