package com.astmutator.mutation;

public enum TraversalOrder {
    /** A node's mutations are offered before those of its descendants. */
    PRE_ORDER,
    /** A node's mutations are offered after those of its descendants. */
    POST_ORDER
}
