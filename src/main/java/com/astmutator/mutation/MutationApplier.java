package com.astmutator.mutation;

import com.astmutator.mutation.errors.CallbackException;
import com.astmutator.mutation.errors.LocationNotFoundException;
import com.github.javaparser.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Swaps a single mutation into a tree and takes it out again.
 * <p>
 * Only the slot holding the target changes: the replacement is put in place of the target
 * and, on undo, the very same target node goes back in its original position among its
 * siblings. No part of the tree is copied.
 */
@Component
public class MutationApplier {
    private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

    /**
     * Applies {@code mutation} to {@code root}. The caller must close the returned handle,
     * preferably with try-with-resources, before applying another mutation to the same tree.
     *
     * @throws LocationNotFoundException if the location does not lead to the mutation's target in this tree
     */
    public AppliedMutation open(Node root, Mutation mutation) {
        MutationLocation location = mutation.getLocation();
        Node resolved = AstPaths.resolve(root, location);
        if (resolved != mutation.getTarget()) {
            throw new LocationNotFoundException(location,
                    "the node found there is not the target of mutation #" + mutation.getId());
        }

        Node replacement = mutation.getReplacement();
        if (location.isRoot()) {
            return new AppliedMutation(mutation, replacement, List.of());
        }
        if (replacement.getParentNode().isPresent()) {
            throw new IllegalStateException("Replacement of mutation #" + mutation.getId()
                    + " is already attached to a tree");
        }
        List<Node> siblings = resolved.getParentNode()
                .map(parent -> List.copyOf(parent.getChildNodes()))
                .orElseThrow(() -> new LocationNotFoundException(location, "the target has no parent"));
        if (!resolved.replace(replacement)) {
            throw new LocationNotFoundException(location, "the target is not held by its parent");
        }
        log.trace("Applied {}", mutation);
        return new AppliedMutation(mutation, root, siblings);
    }

    /**
     * Applies {@code mutation}, hands the mutated tree to {@code callback} and restores the
     * tree on every exit path.
     *
     * @throws LocationNotFoundException if the mutation does not belong to this tree
     * @throws CallbackException         if the callback fails; the tree is already restored
     */
    public void apply(Node root, Mutation mutation, MutationCallback callback) {
        try (AppliedMutation applied = open(root, mutation)) {
            invoke(callback, applied);
        }
    }

    private static void invoke(MutationCallback callback, AppliedMutation applied) {
        try {
            callback.onMutation(applied.getMutation(), applied.getMutatedRoot());
        } catch (Exception e) {
            throw new CallbackException(applied.getMutation(), e);
        }
    }
}
