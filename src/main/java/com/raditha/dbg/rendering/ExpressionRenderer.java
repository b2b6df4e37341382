package com.raditha.dbg.rendering;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.Type;
import com.raditha.dbg.util.ASTUtility;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints an expression tree as Java source, wrapped to a line width.
 * <p>
 * The flat form produced by JavaParser's pretty printer is used whenever it
 * fits. Longer expressions are broken up: method chains before each
 * {@code .call(..)}, calls between their arguments and binary expressions
 * before the operator. Continuation lines are indented by two spaces
 * relative to the first line.
 */
public class ExpressionRenderer {

    public static final int DEFAULT_LINE_WIDTH = 60;

    private static final String INDENT = "  ";

    private final int lineWidth;

    public ExpressionRenderer() {
        this(DEFAULT_LINE_WIDTH);
    }

    public ExpressionRenderer(int lineWidth) {
        if (lineWidth < 10) {
            throw new IllegalArgumentException("lineWidth must be >= 10, got: " + lineWidth);
        }
        this.lineWidth = lineWidth;
    }

    /**
     * Render an expression.
     *
     * @param expression Expression to print
     * @return Source text; lines after the first start with two spaces
     */
    public String render(Expression expression) {
        return String.join("\n" + INDENT, layout(expression, lineWidth));
    }

    private List<String> layout(Expression expression, int width) {
        String flat = print(expression);
        if (fits(flat, width)) {
            return List.of(flat);
        }

        if (expression instanceof MethodCallExpr call) {
            List<MethodCallExpr> chain = chainOf(call);
            if (chain.size() >= 2) {
                return layoutChain(chain, width);
            }
            if (!call.getArguments().isEmpty()) {
                String head = call.getScope().map(s -> print(s) + segmentHead(call)).orElse(segmentHead(call));
                return layoutArguments(head, call.getArguments(), width);
            }
        }
        if (expression instanceof ObjectCreationExpr creation
                && creation.getAnonymousClassBody().isEmpty()
                && !creation.getArguments().isEmpty()) {
            String scope = creation.getScope().map(s -> print(s) + ".").orElse("");
            String head = scope + "new " + print(creation.getType()) + "(";
            return layoutArguments(head, creation.getArguments(), width);
        }
        if (expression instanceof BinaryExpr binary) {
            return layoutBinary(binary, width);
        }
        return splitLines(flat);
    }

    /**
     * Root of the chain first, then one line per call.
     */
    private List<String> layoutChain(List<MethodCallExpr> chain, int width) {
        Expression root = chain.get(0).getScope().orElseThrow();
        List<String> lines = new ArrayList<>(layout(root, width));

        for (MethodCallExpr call : chain) {
            String segment = segmentHead(call) + joinArguments(call.getArguments()) + ")";
            if (fits(segment, width - INDENT.length())) {
                lines.add(INDENT + segment);
            } else {
                for (String line : layoutArguments(segmentHead(call), call.getArguments(), width - INDENT.length())) {
                    lines.add(INDENT + line);
                }
            }
        }
        return lines;
    }

    private List<String> layoutArguments(String head, NodeList<Expression> arguments, int width) {
        List<String> lines = new ArrayList<>();
        lines.add(head);
        for (int i = 0; i < arguments.size(); i++) {
            List<String> argument = layout(arguments.get(i), width - INDENT.length());
            for (int j = 0; j < argument.size(); j++) {
                boolean lastLineOfArgument = j == argument.size() - 1;
                boolean needsComma = lastLineOfArgument && i < arguments.size() - 1;
                lines.add(INDENT + argument.get(j) + (needsComma ? "," : ""));
            }
        }
        lines.add(")");
        return lines;
    }

    private List<String> layoutBinary(BinaryExpr binary, int width) {
        List<String> lines = new ArrayList<>(layout(binary.getLeft(), width));
        List<String> right = layout(binary.getRight(), width - INDENT.length());
        String operator = binary.getOperator().asString();
        lines.add(INDENT + operator + " " + right.get(0));
        for (String line : right.subList(1, right.size())) {
            lines.add(INDENT + line);
        }
        return lines;
    }

    /**
     * Calls of a fluent chain ordered from the innermost outwards. A receiver
     * that is a type name ({@code Stream.of(..)}) stays part of the root.
     */
    private List<MethodCallExpr> chainOf(MethodCallExpr outermost) {
        List<MethodCallExpr> chain = new ArrayList<>();
        Expression current = outermost;
        while (current instanceof MethodCallExpr call
                && call.getScope().isPresent()
                && !ASTUtility.isTypeReference(call.getScope().get())) {
            chain.add(0, call);
            current = call.getScope().get();
        }
        return chain;
    }

    private String segmentHead(MethodCallExpr call) {
        String typeArguments = call.getTypeArguments()
                .map(types -> types.stream().map(Type::asString).collect(Collectors.joining(", ", "<", ">")))
                .orElse("");
        String prefix = call.getScope().isPresent() ? "." : "";
        return prefix + typeArguments + call.getNameAsString() + "(";
    }

    private String joinArguments(NodeList<Expression> arguments) {
        return arguments.stream().map(this::print).collect(Collectors.joining(", "));
    }

    private boolean fits(String text, int width) {
        return text.indexOf('\n') < 0 && text.length() <= width;
    }

    private String print(Node node) {
        return node.toString().replace("\r\n", "\n");
    }

    private List<String> splitLines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
