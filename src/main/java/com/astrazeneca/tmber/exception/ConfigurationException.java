package com.astrazeneca.tmber.exception;


/**
 * Fatal problem with the parameters or inputs of a run, detected before any output is written.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
