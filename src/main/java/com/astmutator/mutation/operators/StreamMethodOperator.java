package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Stream API swaps between methods with identical signatures.
 */
public class StreamMethodOperator implements MutationOperator {

    private static final Map<String, String> MUTATION_MAP = Map.of(
            "findFirst", "findAny",      // Optional<T> -> Optional<T>
            "findAny", "findFirst",
            "anyMatch", "allMatch",      // boolean (Predicate) -> boolean (Predicate)
            "allMatch", "anyMatch",
            "noneMatch", "anyMatch",
            "takeWhile", "dropWhile",    // Stream<T> (Predicate) -> Stream<T> (Predicate)
            "dropWhile", "takeWhile"
    );

    @Override
    public Stream<MethodCallExpr> mutate(Node node) {
        if (!(node instanceof MethodCallExpr call)
                || !MUTATION_MAP.containsKey(call.getNameAsString())
                || !isLikelyStreamCall(call)) {
            return Stream.empty();
        }
        return Stream.of(call).map(c -> Replacements.renamed(c, MUTATION_MAP.get(c.getNameAsString())));
    }

    /**
     * Simple heuristic to identify Stream method calls
     */
    private boolean isLikelyStreamCall(MethodCallExpr call) {
        return call.getScope()
                .map(Object::toString)
                .map(scope -> scope.contains("stream") || scope.contains("Stream."))
                .orElse(false);
    }
}
