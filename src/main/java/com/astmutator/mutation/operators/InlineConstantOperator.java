package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Changes a decimal int literal: {@code 1} becomes {@code 0}, any other {@code n} becomes
 * {@code n + 1}. Hex, octal and binary literals, and values that would overflow, are left alone.
 */
public class InlineConstantOperator implements MutationOperator {

    private static final Pattern DECIMAL = Pattern.compile("0|[1-9][0-9_]*");

    @Override
    public Stream<IntegerLiteralExpr> mutate(Node node) {
        if (!(node instanceof IntegerLiteralExpr literal)) {
            return Stream.empty();
        }
        return Stream.of(literal).flatMap(l -> replacementValue(l.getValue()).stream()
                .map(value -> Replacements.positionedLike(new IntegerLiteralExpr(value), l)));
    }

    private Optional<String> replacementValue(String literal) {
        if (!DECIMAL.matcher(literal).matches()) {
            return Optional.empty();
        }
        long value;
        try {
            value = Long.parseLong(literal.replace("_", ""));
        } catch (NumberFormatException e) {
            // out of long range, javac rejects it anyway
            return Optional.empty();
        }
        long mutated = value == 1 ? 0 : value + 1;
        if (mutated > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(mutated));
    }
}
