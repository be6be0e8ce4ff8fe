package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Inverts JUnit and AssertJ assertions whose counterpart has the same signature.
 */
public class AssertionMethodOperator implements MutationOperator {

    private static final Map<String, String> MUTATION_MAP = Map.ofEntries(
            // JUnit / TestNG
            Map.entry("assertTrue", "assertFalse"),
            Map.entry("assertFalse", "assertTrue"),
            Map.entry("assertNotNull", "assertNull"),
            Map.entry("assertNull", "assertNotNull"),
            Map.entry("assertEquals", "assertNotEquals"),
            Map.entry("assertNotEquals", "assertEquals"),
            Map.entry("assertSame", "assertNotSame"),
            Map.entry("assertNotSame", "assertSame"),
            // AssertJ
            Map.entry("isEqualTo", "isNotEqualTo"),
            Map.entry("isNotEqualTo", "isEqualTo"),
            Map.entry("isTrue", "isFalse"),
            Map.entry("isFalse", "isTrue"),
            Map.entry("isNotNull", "isNull"),
            Map.entry("isNull", "isNotNull"),
            Map.entry("isEmpty", "isNotEmpty"),
            Map.entry("isNotEmpty", "isEmpty"),
            Map.entry("contains", "doesNotContain"),
            Map.entry("doesNotContain", "contains")
    );

    @Override
    public Stream<MethodCallExpr> mutate(Node node) {
        if (!(node instanceof MethodCallExpr call)
                || !MUTATION_MAP.containsKey(call.getNameAsString())
                || !isAssertion(call)) {
            return Stream.empty();
        }
        return Stream.of(call).map(c -> Replacements.renamed(c, MUTATION_MAP.get(c.getNameAsString())));
    }

    /** Bare or Assertions-qualified assertXxx calls, or fluent calls on an assertThat(...) chain. */
    private boolean isAssertion(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (name.startsWith("assert")) {
            return call.getScope().map(scope -> scope.toString().endsWith("Assert")
                    || scope.toString().endsWith("Assertions")).orElse(true);
        }
        return call.getScope().map(scope -> scope.toString().contains("assertThat(")).orElse(false);
    }
}
