package com.astrazeneca.tmber.exception;


import java.util.Locale;

public class MissingSampleColumnException extends ConfigurationException {
    public final static String MissingSampleColumnMessage = "The sample column \"%s\" is missing in %s. " +
            "Please, set the sample name as it is written in the #CHROM header line.";

    public MissingSampleColumnException(String sample, String vcf) {
        super(String.format(Locale.US, MissingSampleColumnMessage, sample, vcf));
    }
}
