package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.Map;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.BinaryExpr.Operator.*;

/**
 * Replaces a comparison with its logical negation.
 */
public class NegateConditionalsOperator implements MutationOperator {

    private static final Map<BinaryExpr.Operator, BinaryExpr.Operator> NEGATIONS = Map.of(
            EQUALS,         NOT_EQUALS,
            NOT_EQUALS,     EQUALS,
            LESS,           GREATER_EQUALS,
            LESS_EQUALS,    GREATER,
            GREATER,        LESS_EQUALS,
            GREATER_EQUALS, LESS
    );

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary) || !NEGATIONS.containsKey(binary.getOperator())) {
            return Stream.empty();
        }
        return Stream.of(binary)
                .map(b -> Replacements.withOperator(b, NEGATIONS.get(b.getOperator())));
    }
}
