package com.raditha.dbg.util;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Utility class for common AST operations.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * Get the source file path from a CompilationUnit.
     *
     * @param cu The CompilationUnit.
     * @return The absolute source file path, empty when the unit was parsed from a string.
     */
    public static Optional<Path> getSourcePath(CompilationUnit cu) {
        return cu.getStorage()
                .map(CompilationUnit.Storage::getPath)
                .map(path -> path.toAbsolutePath().normalize());
    }

    /**
     * A receiver naming a type rather than a value: {@code Math} in
     * {@code Math.max(a, b)}, {@code java.util.List} in {@code java.util.List.of()}.
     * There is no symbol resolution here, so the upper-case naming convention decides.
     */
    public static boolean isTypeReference(Expression expression) {
        if (expression instanceof TypeExpr typeExpr) {
            return receiverVariable(typeExpr).isEmpty();
        }
        if (!isReceiver(expression)) {
            return false;
        }
        if (expression instanceof NameExpr name) {
            return startsUpperCase(name.getNameAsString());
        }
        if (expression instanceof FieldAccessExpr fieldAccess) {
            return startsUpperCase(fieldAccess.getNameAsString()) && isQualifiedName(fieldAccess.getScope());
        }
        return false;
    }

    /**
     * JavaParser parses the receiver of {@code sink::add} as a type. A simple
     * lower-case name without type arguments is read as a variable instead.
     *
     * @param typeExpr Receiver of a method reference
     * @return The variable name, empty when the receiver names a type
     */
    public static Optional<String> receiverVariable(TypeExpr typeExpr) {
        if (typeExpr.getType() instanceof ClassOrInterfaceType type
                && type.getScope().isEmpty()
                && type.getTypeArguments().isEmpty()
                && !startsUpperCase(type.getNameAsString())) {
            return Optional.of(type.getNameAsString());
        }
        return Optional.empty();
    }

    private static boolean isReceiver(Expression expression) {
        Optional<Node> parent = expression.getParentNode();
        if (parent.isEmpty()) {
            return false;
        }
        Node p = parent.get();
        if (p instanceof MethodCallExpr call) {
            return call.getScope().filter(s -> s == expression).isPresent();
        }
        if (p instanceof FieldAccessExpr fieldAccess) {
            return fieldAccess.getScope() == expression;
        }
        if (p instanceof MethodReferenceExpr reference) {
            return reference.getScope() == expression;
        }
        return false;
    }

    private static boolean isQualifiedName(Expression expression) {
        if (expression instanceof NameExpr) {
            return true;
        }
        return expression instanceof FieldAccessExpr fieldAccess && isQualifiedName(fieldAccess.getScope());
    }

    private static boolean startsUpperCase(String identifier) {
        return !identifier.isEmpty() && Character.isUpperCase(identifier.charAt(0));
    }
}
