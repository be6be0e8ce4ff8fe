package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.List;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.BinaryExpr.Operator.*;

/**
 * AOR: replaces each of {@code + - * / %} with every other one, one candidate per operator.
 */
public class ArithmeticOperatorReplacement implements MutationOperator {

    private static final List<BinaryExpr.Operator> ARITHMETIC = List.of(PLUS, MINUS, MULTIPLY, DIVIDE, REMAINDER);

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary) || !ARITHMETIC.contains(binary.getOperator())) {
            return Stream.empty();
        }
        return ARITHMETIC.stream()
                .filter(op -> op != binary.getOperator())
                .map(op -> Replacements.withOperator(binary, op));
    }
}
