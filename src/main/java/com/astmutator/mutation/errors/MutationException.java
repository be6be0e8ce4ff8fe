package com.astmutator.mutation.errors;

/**
 * Base type of every failure raised by the mutation engine.
 */
public class MutationException extends RuntimeException {

    public MutationException(String message) {
        super(message);
    }

    public MutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
