package com.astrazeneca.tmber.data;

/**
 * Sequence ontology terms a variant can be labelled with. {@link #UNCLASSIFIED} is the sentinel for allele
 * pairs matching none of the classification rules and prints as an empty label.
 */
public enum MutationClass {
    SNV("SNV"),
    INSERTION("insertion"),
    DELETION("deletion"),
    DELINS("delins"),
    DUPLICATION("duplication"),
    INVERSION("inversion"),
    STRUCTURAL_VARIANT("structural_variant"),
    COPY_NUMBER_VARIATION("copy_number_variation"),
    NO_SEQUENCE_ALTERATION("no_sequence_alteration"),
    UNCLASSIFIED("");

    private final String label;

    MutationClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return true for every class reported with a zero count when nothing of it was observed
     */
    public boolean isReportedWhenAbsent() {
        return this != UNCLASSIFIED;
    }

    /**
     * @return true if variants of this class count toward the per region set total
     */
    public boolean countsTowardTotal() {
        return this != NO_SEQUENCE_ALTERATION;
    }
}
