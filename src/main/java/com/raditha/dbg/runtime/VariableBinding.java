package com.raditha.dbg.runtime;

/**
 * A variable binding ready for output.
 *
 * @param name  Variable name
 * @param value Rendered value
 */
public record VariableBinding(String name, String value) {
}
