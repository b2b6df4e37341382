package com.raditha.dbg.instrumentation;

/**
 * Thrown when a source file cannot be instrumented, typically because it
 * does not parse.
 */
public class InstrumentationException extends RuntimeException {

    public InstrumentationException(String message) {
        super(message);
    }

    public InstrumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
