package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.UnaryExpr;

import java.util.Map;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.UnaryExpr.Operator.*;

/**
 * Turns increments into decrements and back, keeping prefix/postfix form.
 */
public class IncrementsOperator implements MutationOperator {

    private static final Map<UnaryExpr.Operator, UnaryExpr.Operator> SWAPS = Map.of(
            PREFIX_INCREMENT,  PREFIX_DECREMENT,
            PREFIX_DECREMENT,  PREFIX_INCREMENT,
            POSTFIX_INCREMENT, POSTFIX_DECREMENT,
            POSTFIX_DECREMENT, POSTFIX_INCREMENT
    );

    @Override
    public Stream<UnaryExpr> mutate(Node node) {
        if (!(node instanceof UnaryExpr unary) || !SWAPS.containsKey(unary.getOperator())) {
            return Stream.empty();
        }
        return Stream.of(unary)
                .map(u -> Replacements.withOperator(u, SWAPS.get(u.getOperator())));
    }
}
