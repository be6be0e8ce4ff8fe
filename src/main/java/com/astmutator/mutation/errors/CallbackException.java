package com.astmutator.mutation.errors;

import com.astmutator.mutation.Mutation;
import lombok.Getter;

/**
 * The caller's callback failed for a mutation. The tree has already been restored when this
 * is thrown.
 */
@Getter
public class CallbackException extends MutationException {

    private final Mutation mutation;
    /** Mutations whose callback completed before this one, {@code -1} outside a generation run. */
    private final int deliveredCount;

    public CallbackException(Mutation mutation, Throwable cause) {
        this(mutation, -1, cause);
    }

    public CallbackException(Mutation mutation, int deliveredCount, Throwable cause) {
        super("Callback failed for mutation #" + mutation.getId() + " (" + mutation.getOperatorName()
                + " at " + mutation.getLocation() + ")"
                + (deliveredCount >= 0 ? " after " + deliveredCount + " delivered mutation(s)" : "")
                + ": " + cause, cause);
        this.mutation = mutation;
        this.deliveredCount = deliveredCount;
    }

    public CallbackException withDeliveredCount(int delivered) {
        CallbackException copy = new CallbackException(mutation, delivered, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
