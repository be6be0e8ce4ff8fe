package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;

import java.util.stream.Stream;

public class BooleanLiteralOperator implements MutationOperator {

    @Override
    public Stream<BooleanLiteralExpr> mutate(Node node) {
        if (!(node instanceof BooleanLiteralExpr literal)) {
            return Stream.empty();
        }
        return Stream.of(literal).map(l -> {
            BooleanLiteralExpr flipped = Replacements.copyOf(l);
            flipped.setValue(!l.getValue());
            return flipped;
        });
    }
}
