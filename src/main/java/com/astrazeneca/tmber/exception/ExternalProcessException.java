package com.astrazeneca.tmber.exception;


import java.io.IOException;
import java.util.Locale;

/**
 * Thrown when an external tool exits with a non-zero code. Carries the captured standard error.
 */
public class ExternalProcessException extends IOException {
    public final static String ExternalProcessMessage = "Process: '%s' exit with error code(%d).%n%s";

    private final int exitCode;
    private final String stderr;

    public ExternalProcessException(String command, int exitCode, String stderr) {
        super(String.format(Locale.US, ExternalProcessMessage, command, exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
