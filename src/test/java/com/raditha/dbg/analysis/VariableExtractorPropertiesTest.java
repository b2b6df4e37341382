package com.raditha.dbg.analysis;

import com.github.javaparser.StaticJavaParser;
import net.jqwik.api.*;
import net.jqwik.api.constraints.Size;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Property-based checks: whatever the shape, every variable used is found once.
 */
class VariableExtractorPropertiesTest {

    private final VariableExtractor extractor = new VariableExtractor();

    @Property
    void sumsReportEachVariableOnce(@ForAll @Size(min = 1, max = 8) List<@From("identifiers") String> names) {
        List<String> vars = extractor.extract(StaticJavaParser.parseExpression(String.join(" + ", names)));

        assertEquals(new HashSet<>(names), new HashSet<>(vars));
        assertEquals(new HashSet<>(vars).size(), vars.size());
    }

    @Property
    void callArgumentsAreFoundButNotTheCallName(
            @ForAll @Size(min = 1, max = 8) List<@From("identifiers") String> names) {
        String code = "combine(" + String.join(", ", names) + ")";

        List<String> vars = extractor.extract(StaticJavaParser.parseExpression(code));

        assertEquals(new HashSet<>(names), new HashSet<>(vars));
    }

    @Provide
    Arbitrary<String> identifiers() {
        return Arbitraries.strings().withCharRange('a', 'e').ofMinLength(1).ofMaxLength(3)
                .map(s -> "v_" + s);
    }
}
