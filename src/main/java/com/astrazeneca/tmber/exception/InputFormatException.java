package com.astrazeneca.tmber.exception;


import java.util.Locale;

public class InputFormatException extends RuntimeException {
    public final static String InputFormatMessage = "Malformed line %d in %s: %s";

    public InputFormatException(String source, int lineNumber, String reason) {
        super(String.format(Locale.US, InputFormatMessage, lineNumber, source, reason));
    }

    public InputFormatException(String source, int lineNumber, String reason, Throwable e) {
        super(String.format(Locale.US, InputFormatMessage, lineNumber, source, reason), e);
    }
}
