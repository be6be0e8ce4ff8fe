package com.astmutator.mutation;

import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Path from the root of a tree to one of its nodes.
 * <p>
 * Each step names a metamodel property of the parent ({@code left}, {@code arguments}, ...)
 * and, for list properties, the element index. Locations share their prefix with the
 * parent location, so extending one while walking the tree is O(1).
 */
public final class MutationLocation {

    private static final MutationLocation ROOT = new MutationLocation(null, null, 0);

    private final MutationLocation parent;
    private final Step step;
    private final int depth;

    private MutationLocation(MutationLocation parent, Step step, int depth) {
        this.parent = parent;
        this.step = step;
        this.depth = depth;
    }

    public static MutationLocation root() {
        return ROOT;
    }

    public MutationLocation child(Step step) {
        return new MutationLocation(this, Objects.requireNonNull(step, "step"), depth + 1);
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public int depth() {
        return depth;
    }

    /** The step leading into the located node, {@code null} for the root. */
    public Step lastStep() {
        return step;
    }

    public List<Step> steps() {
        if (isRoot()) {
            return List.of();
        }
        List<Step> steps = new ArrayList<>(depth);
        for (MutationLocation current = this; !current.isRoot(); current = current.parent) {
            steps.add(current.step);
        }
        Collections.reverse(steps);
        return Collections.unmodifiableList(steps);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MutationLocation other)) return false;
        return depth == other.depth && steps().equals(other.steps());
    }

    @Override
    public int hashCode() {
        return steps().hashCode();
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (Step s : steps()) {
            sb.append('/').append(s);
        }
        return sb.toString();
    }

    /**
     * One edge of a location path.
     *
     * @param property metamodel property name on the parent
     * @param index    element index for list properties, {@code -1} for single-valued ones
     * @param slotType declared node type of the slot
     */
    public record Step(String property, int index, Class<? extends Node> slotType) {

        public static Step single(String property, Class<? extends Node> slotType) {
            return new Step(property, -1, slotType);
        }

        public static Step element(String property, int index, Class<? extends Node> slotType) {
            if (index < 0) {
                throw new IllegalArgumentException("Negative list index " + index + " for " + property);
            }
            return new Step(property, index, slotType);
        }

        public boolean isListElement() {
            return index >= 0;
        }

        @Override
        public String toString() {
            return isListElement() ? property + "[" + index + "]" : property;
        }
    }
}
