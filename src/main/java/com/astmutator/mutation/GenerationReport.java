package com.astmutator.mutation;

/**
 * Outcome of a generation run that finished without error.
 *
 * @param delivered    mutations whose callback completed
 * @param visitedNodes nodes the traversal reached
 * @param cancelled    whether the caller stopped the run early
 */
public record GenerationReport(int delivered, int visitedNodes, boolean cancelled) {
}
