package com.astrazeneca.tmber.exception;


import java.util.Locale;

public class EmptyRegionSetException extends ConfigurationException {
    public final static String EmptyRegionSetMessage = "The region set %s can't be used for TMB: %s.";

    public EmptyRegionSetException(String name, String reason) {
        super(String.format(Locale.US, EmptyRegionSetMessage, name, reason));
    }
}
