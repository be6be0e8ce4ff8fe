package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Swaps {@code isPresent} and {@code isEmpty} on calls that look like Optional usage.
 */
public class OptionalMethodOperator implements MutationOperator {

    private static final Map<String, String> SAFE_MUTATION_MAP = Map.of(
            "isPresent", "isEmpty",
            "isEmpty", "isPresent"
    );

    private static final Set<String> OPTIONAL_PRODUCERS = Set.of(
            "findFirst", "findAny", "max", "min", "reduce", "ofNullable", "of", "empty");

    @Override
    public Stream<MethodCallExpr> mutate(Node node) {
        if (!(node instanceof MethodCallExpr call)
                || !SAFE_MUTATION_MAP.containsKey(call.getNameAsString())
                || !call.getArguments().isEmpty()
                || !isLikelyOptionalCall(call)) {
            return Stream.empty();
        }
        return Stream.of(call).map(c -> Replacements.renamed(c, SAFE_MUTATION_MAP.get(c.getNameAsString())));
    }

    private boolean isLikelyOptionalCall(MethodCallExpr call) {
        Expression scope = call.getScope().orElse(null);
        if (scope == null) {
            return false;
        }
        if (scope instanceof MethodCallExpr producer && OPTIONAL_PRODUCERS.contains(producer.getNameAsString())) {
            return true;
        }
        return scope.toString().toLowerCase(Locale.ROOT).contains("optional");
    }
}
