package com.raditha.dbg.analysis;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.raditha.dbg.model.SourceRange;

import java.util.Optional;

/**
 * Computes the lines spanned by an expression tree from the position
 * metadata of its nodes.
 */
public class SourceRangeLocator {

    /**
     * Walk every node of the tree and keep the smallest begin line and the
     * largest end line. Nodes without a range (synthesized by a rewrite) are
     * ignored.
     *
     * @param node Root of the tree
     * @return The spanned lines, {@link SourceRange#unknown()} if no node has a range
     */
    public SourceRange locate(Node node) {
        Integer lineMin = null;
        Integer lineMax = null;

        for (Node current : node.findAll(Node.class)) {
            Optional<Range> range = current.getRange();
            if (range.isEmpty()) {
                continue;
            }
            int begin = range.get().begin.line;
            int end = range.get().end.line;
            if (lineMin == null || begin < lineMin) {
                lineMin = begin;
            }
            if (lineMax == null || end > lineMax) {
                lineMax = end;
            }
        }

        if (lineMin == null) {
            return SourceRange.unknown();
        }
        return new SourceRange(lineMin, lineMax);
    }
}
