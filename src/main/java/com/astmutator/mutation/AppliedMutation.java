package com.astmutator.mutation;

import com.github.javaparser.ast.Node;
import lombok.Getter;

import java.util.List;

/**
 * A mutation currently swapped into its tree. Closing it puts the original node back;
 * closing twice is a no-op.
 * <p>
 * JavaParser appends a node to its parent's child list whenever it is attached, so the undo
 * also re-attaches the parent's children in the order they had before the swap.
 */
public final class AppliedMutation implements AutoCloseable {

    @Getter
    private final Mutation mutation;
    @Getter
    private final Node mutatedRoot;
    /** Children of the target's parent before the swap, empty when nothing was swapped. */
    private final List<Node> siblings;
    private boolean closed;

    AppliedMutation(Mutation mutation, Node mutatedRoot, List<Node> siblings) {
        this.mutation = mutation;
        this.mutatedRoot = mutatedRoot;
        this.siblings = List.copyOf(siblings);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (siblings.isEmpty()) {
            return;
        }
        Node target = mutation.getTarget();
        if (!mutation.getReplacement().replace(target)) {
            throw new IllegalStateException("Could not restore the original node of mutation #"
                    + mutation.getId() + " at " + mutation.getLocation()
                    + "; the replacement was detached while the mutation was applied");
        }
        Node parent = target.getParentNode().orElseThrow();
        for (Node sibling : siblings) {
            sibling.setParentNode(null);
            sibling.setParentNode(parent);
        }
    }
}
