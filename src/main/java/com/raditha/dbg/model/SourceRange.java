package com.raditha.dbg.model;

/**
 * Lines spanned by an expression tree.
 * Both bounds are null when no node in the tree carries position metadata.
 *
 * @param lineMin First line (1-indexed), or null
 * @param lineMax Last line (1-indexed, inclusive), or null
 */
public record SourceRange(Integer lineMin, Integer lineMax) {

    private static final SourceRange UNKNOWN = new SourceRange(null, null);

    /**
     * Range of a tree without any line metadata.
     */
    public static SourceRange unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return lineMin != null && lineMax != null;
    }

    /**
     * True when the expression starts and ends on different lines.
     */
    public boolean isMultiLine() {
        return isKnown() && lineMin < lineMax;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (!isKnown()) {
            return "L?";
        }
        if (lineMin.equals(lineMax)) {
            return "L" + lineMin;
        }
        return "L" + lineMin + "-" + lineMax;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
