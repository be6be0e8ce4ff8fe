package com.astmutator.mutation;

import com.github.javaparser.ast.Node;

import java.util.stream.Stream;

/**
 * A pluggable rule that maps one node to candidate replacement nodes.
 * <p>
 * Implementations must be side-effect free: they never modify {@code node} and each call
 * returns a fresh lazy stream. A node the operator does not handle yields an empty stream.
 * Every candidate must be able to stand in the slot of {@code node}.
 */
public interface MutationOperator {

    Stream<? extends Node> mutate(Node node);

    default String name() {
        return getClass().getSimpleName();
    }
}
