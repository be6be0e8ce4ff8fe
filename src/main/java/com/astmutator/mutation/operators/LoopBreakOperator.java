package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;

import java.util.stream.Stream;

/**
 * Replaces {@code continue} with {@code break}, keeping a label if there is one.
 */
public class LoopBreakOperator implements MutationOperator {

    @Override
    public Stream<BreakStmt> mutate(Node node) {
        if (!(node instanceof ContinueStmt continueStmt)) {
            return Stream.empty();
        }
        return Stream.of(continueStmt).map(c -> {
            BreakStmt breakStmt = new BreakStmt();
            breakStmt.removeLabel();
            c.getLabel().ifPresent(label -> breakStmt.setLabel(label.clone()));
            return Replacements.positionedLike(breakStmt, c);
        });
    }
}
