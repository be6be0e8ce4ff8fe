package com.astmutator.mutation;

/**
 * Receives discovered mutations without any tree being mutated.
 */
@FunctionalInterface
public interface MutationListener {
    void onMutation(Mutation mutation) throws Exception;
}
