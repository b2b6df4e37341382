package com.raditha.dbg.runtime;

/**
 * A variable captured at an instrumented call site, with its live value.
 *
 * @param name  Variable name as written in the source
 * @param value Value read right after the inspected expression was evaluated
 */
public record Binding(String name, Object value) {
}
