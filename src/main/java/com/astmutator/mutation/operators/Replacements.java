package com.astmutator.mutation.operators;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

/**
 * Builders for replacement nodes. Every replacement is a fresh node carrying the range of
 * the node it stands in for, so positions reported for a mutant point at the original code.
 */
final class Replacements {

    private Replacements() {
    }

    @SuppressWarnings("unchecked")
    static <N extends Node> N copyOf(N original) {
        N copy = (N) original.clone();
        original.getRange().ifPresent(copy::setRange);
        return copy;
    }

    static <N extends Node> N positionedLike(N replacement, Node original) {
        original.getRange().ifPresent(replacement::setRange);
        return replacement;
    }

    static BinaryExpr withOperator(BinaryExpr original, BinaryExpr.Operator operator) {
        BinaryExpr copy = copyOf(original);
        copy.setOperator(operator);
        return copy;
    }

    static UnaryExpr withOperator(UnaryExpr original, UnaryExpr.Operator operator) {
        UnaryExpr copy = copyOf(original);
        copy.setOperator(operator);
        return copy;
    }

    static MethodCallExpr renamed(MethodCallExpr original, String name) {
        MethodCallExpr copy = copyOf(original);
        copy.setName(name);
        return copy;
    }
}
