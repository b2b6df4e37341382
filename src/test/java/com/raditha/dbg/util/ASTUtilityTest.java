package com.raditha.dbg.util;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ASTUtility.
 */
class ASTUtilityTest {

    private Expression receiverOf(String reference) {
        MethodReferenceExpr expr = StaticJavaParser.parseExpression(reference).asMethodReferenceExpr();
        return expr.getScope();
    }

    @Test
    void testMethodReferenceReceivers() {
        Expression variable = receiverOf("sink::add");
        Expression type = receiverOf("String::valueOf");

        assertInstanceOf(TypeExpr.class, variable);
        assertEquals(Optional.of("sink"), ASTUtility.receiverVariable((TypeExpr) variable));
        assertFalse(ASTUtility.isTypeReference(variable));
        assertTrue(ASTUtility.isTypeReference(type));
    }

    @Test
    void testQualifiedAndGenericReceiversAreTypes() {
        assertTrue(ASTUtility.isTypeReference(receiverOf("java.util.Objects::isNull")));
        assertTrue(ASTUtility.isTypeReference(receiverOf("java.util.List<String>::size")));
    }

    @Test
    void testCallReceivers() {
        Expression call = StaticJavaParser.parseExpression("Math.max(total, limit)");
        Expression receiver = call.asMethodCallExpr().getScope().orElseThrow();
        Expression argument = call.asMethodCallExpr().getArgument(0);

        assertTrue(ASTUtility.isTypeReference(receiver));
        assertFalse(ASTUtility.isTypeReference(argument));
        assertFalse(ASTUtility.isTypeReference(StaticJavaParser.parseExpression("Math")));
    }

    @Test
    void testSourcePath(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("A.java");
        Files.writeString(file, "class A {}\n");

        CompilationUnit fromFile = StaticJavaParser.parse(file);
        CompilationUnit fromString = StaticJavaParser.parse("class A {}");

        assertEquals(Optional.of(file.toAbsolutePath().normalize()), ASTUtility.getSourcePath(fromFile));
        assertTrue(ASTUtility.getSourcePath(fromString).isEmpty());
    }
}
