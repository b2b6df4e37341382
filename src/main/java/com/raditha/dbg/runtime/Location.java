package com.raditha.dbg.runtime;

/**
 * File and line of an instrumented call site.
 *
 * @param file Source file path as recorded at instrumentation time
 * @param line Line of the marker call
 */
public record Location(String file, int line) {
}
