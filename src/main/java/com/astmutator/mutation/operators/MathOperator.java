package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.Map;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.BinaryExpr.Operator.*;

/**
 * Replaces an arithmetic, bitwise or shift operator with its counterpart
 * ({@code *} becomes {@code /}, {@code +} becomes {@code -}, ...).
 */
public class MathOperator implements MutationOperator {

    private static final Map<BinaryExpr.Operator, BinaryExpr.Operator> REPLACEMENTS = Map.ofEntries(
            Map.entry(PLUS,                 MINUS),
            Map.entry(MINUS,                PLUS),
            Map.entry(MULTIPLY,             DIVIDE),
            Map.entry(DIVIDE,               MULTIPLY),
            Map.entry(REMAINDER,            MULTIPLY),
            Map.entry(BINARY_AND,           BINARY_OR),
            Map.entry(BINARY_OR,            BINARY_AND),
            Map.entry(XOR,                  BINARY_AND),
            Map.entry(LEFT_SHIFT,           SIGNED_RIGHT_SHIFT),
            Map.entry(SIGNED_RIGHT_SHIFT,   LEFT_SHIFT),
            Map.entry(UNSIGNED_RIGHT_SHIFT, LEFT_SHIFT)
    );

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary) || !REPLACEMENTS.containsKey(binary.getOperator())) {
            return Stream.empty();
        }
        return Stream.of(binary)
                .map(b -> Replacements.withOperator(b, REPLACEMENTS.get(b.getOperator())));
    }
}
