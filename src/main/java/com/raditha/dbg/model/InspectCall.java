package com.raditha.dbg.model;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;

/**
 * A recognized instrumenting call: the expression to trace, the options
 * given with it and its location.
 *
 * @param call    The marker call itself ({@code Dbg.inspect(..)} or {@code ..dbg()})
 * @param target  The expression being inspected
 * @param options Options parsed from the call arguments
 * @param site    File and line of the marker call
 * @param form    How the target was handed to the marker
 */
public record InspectCall(
        MethodCallExpr call,
        Expression target,
        InspectOptions options,
        CallSite site,
        Form form) {

    /**
     * Call-site shapes.
     */
    public enum Form {
        /** {@code Dbg.inspect(expr)} */
        DIRECT,
        /** {@code expr.dbg()}, the target is the receiver of the marker. */
        CHAINED
    }
}
