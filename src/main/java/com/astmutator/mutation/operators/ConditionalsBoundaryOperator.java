package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.Map;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.BinaryExpr.Operator.*;

public class ConditionalsBoundaryOperator implements MutationOperator {

    private static final Map<BinaryExpr.Operator, BinaryExpr.Operator> BOUNDARIES = Map.of(
            LESS,           LESS_EQUALS,
            LESS_EQUALS,    LESS,
            GREATER,        GREATER_EQUALS,
            GREATER_EQUALS, GREATER
    );

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary) || !BOUNDARIES.containsKey(binary.getOperator())) {
            return Stream.empty();
        }
        return Stream.of(binary)
                .map(b -> Replacements.withOperator(b, BOUNDARIES.get(b.getOperator())));
    }
}
