package com.astmutator.mutation;

import com.github.javaparser.ast.Node;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Descriptor of one candidate mutation: replace {@link #target} at {@link #location} with
 * {@link #replacement}. Produced by {@link MutationGenerator} and valid only for the tree it
 * was generated from.
 */
@Getter
@AllArgsConstructor
public class Mutation {
    /** Ordinal within one generation run; stable for the same tree and operators. */
    private final int id;
    private final MutationLocation location;
    private final Node target;
    private final Node replacement;
    private final String operatorName;

    @Override
    public String toString() {
        return "#" + id + " " + operatorName + " at " + location
                + ": '" + target + "' -> '" + replacement + "'";
    }
}
