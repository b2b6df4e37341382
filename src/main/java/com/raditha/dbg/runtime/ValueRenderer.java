package com.raditha.dbg.runtime;

/**
 * Turns a runtime value into the text shown in a trace.
 */
@FunctionalInterface
public interface ValueRenderer {

    String render(Object value);
}
