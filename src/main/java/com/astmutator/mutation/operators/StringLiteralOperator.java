package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.StringLiteralExpr;

import java.util.stream.Stream;

/**
 * Wraps a string literal's content in {@code XX...XX}.
 */
public class StringLiteralOperator implements MutationOperator {

    static final String MARKER = "XX";

    @Override
    public Stream<StringLiteralExpr> mutate(Node node) {
        if (!(node instanceof StringLiteralExpr literal)) {
            return Stream.empty();
        }
        return Stream.of(literal).map(l -> {
            StringLiteralExpr wrapped = Replacements.copyOf(l);
            wrapped.setValue(MARKER + l.getValue() + MARKER);
            return wrapped;
        });
    }
}
