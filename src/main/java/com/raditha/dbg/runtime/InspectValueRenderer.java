package com.raditha.dbg.runtime;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Default value rendering. Strings and characters are quoted and escaped so
 * that {@code "12"} and {@code 12} can be told apart; arrays, collections
 * and maps render their elements the same way. Everything else uses
 * {@link Object#toString()}.
 */
public class InspectValueRenderer implements ValueRenderer {

    @Override
    public String render(Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    private void append(StringBuilder out, Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof CharSequence text) {
            out.append('"').append(escape(text.toString(), '"')).append('"');
        } else if (value instanceof Character c) {
            out.append('\'').append(escape(c.toString(), '\'')).append('\'');
        } else if (value.getClass().isArray()) {
            appendArray(out, value);
        } else if (value instanceof Collection<?> collection) {
            appendElements(out, collection.iterator(), collection);
        } else if (value instanceof Map<?, ?> map) {
            appendMap(out, map);
        } else {
            out.append(value);
        }
    }

    private void appendArray(StringBuilder out, Object array) {
        out.append('[');
        int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                out.append(", ");
            }
            Object element = Array.get(array, i);
            if (element == array) {
                out.append("[...]");
            } else {
                append(out, element);
            }
        }
        out.append(']');
    }

    private void appendElements(StringBuilder out, Iterator<?> elements, Object self) {
        out.append('[');
        boolean first = true;
        while (elements.hasNext()) {
            Object element = elements.next();
            if (!first) {
                out.append(", ");
            }
            first = false;
            if (element == self) {
                out.append("(this Collection)");
            } else {
                append(out, element);
            }
        }
        out.append(']');
    }

    private void appendMap(StringBuilder out, Map<?, ?> map) {
        out.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            appendMapPart(out, entry.getKey(), map);
            out.append('=');
            appendMapPart(out, entry.getValue(), map);
        }
        out.append('}');
    }

    private void appendMapPart(StringBuilder out, Object part, Map<?, ?> map) {
        if (part == map) {
            out.append("(this Map)");
        } else {
            append(out, part);
        }
    }

    static String escape(String text, char quote) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                case '\b' -> escaped.append("\\b");
                case '\f' -> escaped.append("\\f");
                default -> {
                    if (c == quote) {
                        escaped.append('\\').append(c);
                    } else if (c < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
