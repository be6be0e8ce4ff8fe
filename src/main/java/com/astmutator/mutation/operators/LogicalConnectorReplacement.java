package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.stream.Stream;

/**
 * Swaps {@code &&} and {@code ||}.
 */
public class LogicalConnectorReplacement implements MutationOperator {

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary)) {
            return Stream.empty();
        }
        return switch (binary.getOperator()) {
            case AND -> Stream.of(binary).map(b -> Replacements.withOperator(b, BinaryExpr.Operator.OR));
            case OR -> Stream.of(binary).map(b -> Replacements.withOperator(b, BinaryExpr.Operator.AND));
            default -> Stream.empty();
        };
    }
}
