package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;

import java.util.List;
import java.util.stream.Stream;

import static com.github.javaparser.ast.expr.BinaryExpr.Operator.*;

/**
 * ROR: replaces a relational operator (e.g. {@code <} with {@code <=}, {@code ==} with {@code !=})
 * with each of the other relational operators.
 */
public class RelationalOperatorReplacement implements MutationOperator {

    private static final List<BinaryExpr.Operator> RELATIONAL = List.of(
            LESS,            // <
            LESS_EQUALS,     // <=
            GREATER,         // >
            GREATER_EQUALS,  // >=
            EQUALS,          // ==
            NOT_EQUALS       // !=
    );

    @Override
    public Stream<BinaryExpr> mutate(Node node) {
        if (!(node instanceof BinaryExpr binary) || !RELATIONAL.contains(binary.getOperator())) {
            return Stream.empty();
        }
        return RELATIONAL.stream()
                .filter(op -> op != binary.getOperator())
                .map(op -> Replacements.withOperator(binary, op));
    }
}
