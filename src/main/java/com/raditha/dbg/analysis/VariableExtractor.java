package com.raditha.dbg.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.dbg.util.ASTUtility;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the free variables read by an expression.
 * <p>
 * Every compound node is looked at as {@code (head, args...)}. The arguments
 * are searched first, each on its own, and the head is searched last with
 * their results already accumulated. A variable found in head position is
 * placed in front of the accumulator, so for {@code a.m(b)} the result is
 * {@code [a, b]} and for {@code f(x, g(y))} it is {@code [x, y]}.
 * <p>
 * Names used as call targets, type names in receiver position and names bound
 * inside the expression itself (lambda parameters, locals of lambda bodies,
 * pattern variables) are never reported.
 */
public class VariableExtractor {

    /**
     * Extract the variables of an expression.
     *
     * @param expression Expression to analyze
     * @return Unique variable names in discovery order
     */
    public List<String> extract(Expression expression) {
        List<String> found = collect(expression, new ArrayList<>());
        Set<String> bound = findBoundNames(expression);

        Set<String> unique = new LinkedHashSet<>();
        for (String name : found) {
            if (!bound.contains(name)) {
                unique.add(name);
            }
        }
        return List.copyOf(unique);
    }

    private List<String> collect(Node node, List<String> vars) {
        Optional<String> variable = variableName(node);
        if (variable.isPresent()) {
            List<String> result = new ArrayList<>(vars.size() + 1);
            result.add(variable.get());
            result.addAll(vars);
            return result;
        }

        Optional<List<? extends Node>> collection = collectionElements(node);
        if (collection.isPresent()) {
            return collectCollection(collection.get(), vars);
        }

        return collectCompound(decompose(node), vars);
    }

    /**
     * Searches each argument in isolation, then the head with the merged result.
     */
    private List<String> collectCompound(List<? extends Node> parts, List<String> vars) {
        if (parts.isEmpty()) {
            return vars;
        }
        List<String> merged = new ArrayList<>(vars);
        for (Node arg : parts.subList(1, parts.size())) {
            merged.addAll(collect(arg, new ArrayList<>()));
        }
        return collect(parts.get(0), merged);
    }

    private List<String> collectCollection(List<? extends Node> elements, List<String> vars) {
        // {call(..), {a, b}} reads as call(.., a, b)
        if (elements.size() == 2 && isCompound(elements.get(0))) {
            Optional<List<? extends Node>> trailing = collectionElements(elements.get(1));
            if (trailing.isPresent()) {
                List<Node> flattened = new ArrayList<>();
                flattened.add(elements.get(0));
                flattened.addAll(trailing.get());
                return collectCompound(flattened, vars);
            }
        }

        List<String> result = new ArrayList<>(vars);
        for (Node element : elements) {
            bareVariable(element).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Accepts a bare variable, looking through one level of parentheses or cast.
     */
    private Optional<String> bareVariable(Node element) {
        Node unwrapped = element;
        if (element instanceof EnclosedExpr enclosed) {
            unwrapped = enclosed.getInner();
        } else if (element instanceof CastExpr cast) {
            unwrapped = cast.getExpression();
        }
        return variableName(unwrapped);
    }

    /**
     * Splits a node into {@code [head, args...]}. Empty when the node holds no
     * variables of its own.
     */
    private List<? extends Node> decompose(Node node) {
        if (node instanceof BinaryExpr binary) {
            return List.of(binary.getLeft(), binary.getRight());
        }
        if (node instanceof MethodCallExpr call) {
            Optional<Expression> scope = call.getScope().filter(s -> !ASTUtility.isTypeReference(s));
            if (scope.isPresent()) {
                List<Node> parts = new ArrayList<>();
                parts.add(scope.get());
                parts.addAll(call.getArguments());
                return parts;
            }
            return call.getArguments();
        }
        if (node instanceof ObjectCreationExpr creation) {
            return creation.getArguments();
        }
        if (node instanceof ConditionalExpr conditional) {
            return List.of(conditional.getCondition(), conditional.getThenExpr(), conditional.getElseExpr());
        }
        if (node instanceof ArrayAccessExpr access) {
            return List.of(access.getName(), access.getIndex());
        }
        if (node instanceof UnaryExpr unary) {
            return List.of(unary.getExpression());
        }
        if (node instanceof EnclosedExpr enclosed) {
            return List.of(enclosed.getInner());
        }
        if (node instanceof CastExpr cast) {
            return List.of(cast.getExpression());
        }
        if (node instanceof InstanceOfExpr instanceOf) {
            return List.of(instanceOf.getExpression());
        }
        if (node instanceof AssignExpr assign) {
            return List.of(assign.getValue());
        }
        if (node instanceof FieldAccessExpr fieldAccess) {
            return ASTUtility.isTypeReference(fieldAccess.getScope()) ? List.of() : List.of(fieldAccess.getScope());
        }
        if (node instanceof MethodReferenceExpr reference) {
            return ASTUtility.isTypeReference(reference.getScope()) ? List.of() : List.of(reference.getScope());
        }
        if (node instanceof ArrayCreationExpr creation && creation.getInitializer().isEmpty()) {
            return creation.getLevels().stream()
                    .flatMap(level -> level.getDimension().stream())
                    .toList();
        }
        if (node instanceof LambdaExpr lambda) {
            return List.of(lambda.getBody());
        }
        if (node instanceof ExpressionStmt statement) {
            return List.of(statement.getExpression());
        }
        if (node instanceof BlockStmt block) {
            return block.getStatements();
        }
        if (node instanceof Statement || node instanceof VariableDeclarationExpr || node instanceof VariableDeclarator) {
            // other statements of a lambda block: walk their expression children
            return node.getChildNodes().stream()
                    .filter(child -> child instanceof Expression
                            || child instanceof Statement
                            || child instanceof VariableDeclarator)
                    .toList();
        }
        return List.of();
    }

    private Optional<List<? extends Node>> collectionElements(Node node) {
        if (node instanceof ArrayInitializerExpr initializer) {
            return Optional.of(initializer.getValues());
        }
        if (node instanceof ArrayCreationExpr creation && creation.getInitializer().isPresent()) {
            return Optional.of(creation.getInitializer().get().getValues());
        }
        return Optional.empty();
    }

    private boolean isCompound(Node node) {
        return !isVariable(node)
                && !(node instanceof LiteralExpr)
                && collectionElements(node).isEmpty();
    }

    private boolean isVariable(Node node) {
        return variableName(node).isPresent();
    }

    private Optional<String> variableName(Node node) {
        if (node instanceof NameExpr name && !ASTUtility.isTypeReference(name)) {
            return Optional.of(name.getNameAsString());
        }
        if (node instanceof TypeExpr typeExpr) {
            return ASTUtility.receiverVariable(typeExpr);
        }
        return Optional.empty();
    }

    /**
     * Names declared inside the expression; reading them at the call site is
     * impossible.
     */
    private Set<String> findBoundNames(Expression expression) {
        Set<String> bound = new HashSet<>();
        expression.findAll(Parameter.class).forEach(p -> bound.add(p.getNameAsString()));
        expression.findAll(VariableDeclarator.class).forEach(v -> bound.add(v.getNameAsString()));
        expression.findAll(TypePatternExpr.class).forEach(p -> bound.add(p.getNameAsString()));
        return bound;
    }
}
