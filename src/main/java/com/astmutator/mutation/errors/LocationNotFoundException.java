package com.astmutator.mutation.errors;

import com.astmutator.mutation.MutationLocation;
import lombok.Getter;

/**
 * A mutation location does not resolve against the tree it is applied to, usually because
 * the descriptor was produced from a different tree.
 */
@Getter
public class LocationNotFoundException extends MutationException {

    private final MutationLocation location;

    public LocationNotFoundException(MutationLocation location, String reason) {
        super("Location " + location + " not found: " + reason);
        this.location = location;
    }
}
