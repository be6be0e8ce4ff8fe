package com.astmutator.mutation;

import com.github.javaparser.ast.Node;

/**
 * Receives each mutation together with the mutated tree. The tree is only valid until the
 * method returns; it is restored afterwards even if the method throws.
 */
@FunctionalInterface
public interface MutationCallback {
    void onMutation(Mutation mutation, Node mutatedRoot) throws Exception;
}
