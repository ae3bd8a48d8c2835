package com.astrazeneca.tmber.exception;


import java.util.Locale;

public class ExecutableNotFoundException extends ConfigurationException {
    public final static String ExecutableNotFoundMessage = "Command not found: %s. Please, check that it is " +
            "installed and available in PATH.";

    public ExecutableNotFoundException(String command) {
        super(String.format(Locale.US, ExecutableNotFoundMessage, command));
    }
}
