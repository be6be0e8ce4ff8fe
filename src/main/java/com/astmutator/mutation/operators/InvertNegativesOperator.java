package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;

import java.util.stream.Stream;

/**
 * Drops a unary minus: {@code -x} becomes {@code x}.
 */
public class InvertNegativesOperator implements MutationOperator {

    @Override
    public Stream<Expression> mutate(Node node) {
        if (!(node instanceof UnaryExpr unary) || unary.getOperator() != UnaryExpr.Operator.MINUS) {
            return Stream.empty();
        }
        return Stream.of(unary)
                .map(u -> Replacements.positionedLike(u.getExpression().clone(), u));
    }
}
