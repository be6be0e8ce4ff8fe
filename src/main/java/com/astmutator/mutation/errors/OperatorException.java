package com.astmutator.mutation.errors;

import com.astmutator.mutation.MutationLocation;
import lombok.Getter;

/**
 * An operator failed while its candidates were enumerated, or produced a candidate that
 * cannot take the place of the visited node. Generation stops; mutations delivered before
 * the failure remain valid.
 */
@Getter
public class OperatorException extends MutationException {

    private final String operatorName;
    private final MutationLocation location;
    private final int deliveredCount;

    public OperatorException(String operatorName, MutationLocation location, int deliveredCount, String reason) {
        super(message(operatorName, location, deliveredCount, reason));
        this.operatorName = operatorName;
        this.location = location;
        this.deliveredCount = deliveredCount;
    }

    public OperatorException(String operatorName, MutationLocation location, int deliveredCount, Throwable cause) {
        super(message(operatorName, location, deliveredCount, String.valueOf(cause)), cause);
        this.operatorName = operatorName;
        this.location = location;
        this.deliveredCount = deliveredCount;
    }

    private static String message(String operatorName, MutationLocation location, int deliveredCount, String reason) {
        return "Operator " + operatorName + " failed at " + location
                + " after " + deliveredCount + " delivered mutation(s): " + reason;
    }
}
