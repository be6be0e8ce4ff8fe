package com.astmutator.mutation;

import com.astmutator.mutation.MutationLocation.Step;
import com.astmutator.mutation.errors.LocationNotFoundException;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.metamodel.PropertyMetaModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Structural navigation over JavaParser trees based on the node metamodel.
 * <p>
 * Children are read from the metamodel properties instead of {@link Node#getChildNodes()},
 * because the latter is reordered every time a slot is replaced and would make locations
 * unstable across apply/undo cycles.
 */
public final class AstPaths {

    private static final String COMMENT_PROPERTY = "comment";

    private static final List<Class<? extends Node>> CATEGORIES = List.of(
            Expression.class,
            Statement.class,
            BodyDeclaration.class,
            Type.class
    );

    private static final Comparator<Child> BY_BEGIN = (a, b) -> {
        Optional<Position> left = a.node().getBegin();
        Optional<Position> right = b.node().getBegin();
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get());
        }
        if (left.isPresent()) return -1;
        if (right.isPresent()) return 1;
        return 0;
    };

    private AstPaths() {
    }

    /** A child node together with the step that reaches it from its parent. */
    public record Child(Step step, Node node) {
    }

    /**
     * Returns the node-valued children of {@code node} in source order. List properties are
     * expanded element by element; comments are not treated as children.
     */
    public static List<Child> children(Node node) {
        List<Child> children = new ArrayList<>();
        for (PropertyMetaModel property : node.getMetaModel().getAllPropertyMetaModels()) {
            if (!isChildProperty(property)) {
                continue;
            }
            Object value = property.getValue(node);
            if (value == null) {
                continue;
            }
            Class<? extends Node> slotType = slotType(property);
            if (value instanceof NodeList<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    children.add(new Child(Step.element(property.getName(), i, slotType), list.get(i)));
                }
            } else if (value instanceof Node child) {
                children.add(new Child(Step.single(property.getName(), slotType), child));
            }
        }
        // List.sort is stable, so metamodel order decides between equal positions
        children.sort(BY_BEGIN);
        return children;
    }

    /**
     * Follows {@code location} from {@code root}.
     *
     * @throws LocationNotFoundException if a step does not exist in this tree
     */
    public static Node resolve(Node root, MutationLocation location) {
        Node current = root;
        for (Step step : location.steps()) {
            String typeName = current.getMetaModel().getTypeName();
            PropertyMetaModel property = findProperty(current, step.property())
                    .orElseThrow(() -> new LocationNotFoundException(location,
                            "no property '" + step.property() + "' on " + typeName));
            Object value = property.getValue(current);
            if (step.isListElement()) {
                if (!(value instanceof NodeList<?> list) || step.index() >= list.size()) {
                    throw new LocationNotFoundException(location, "no element " + step + " on " + typeName);
                }
                current = list.get(step.index());
            } else {
                if (!(value instanceof Node child)) {
                    throw new LocationNotFoundException(location, "empty slot '" + step + "' on " + typeName);
                }
                current = child;
            }
        }
        return current;
    }

    /**
     * Whether {@code replacement} may take the place of {@code target} at {@code location}.
     * For a slot the replacement must match the slot's declared type; for the root it must
     * stay in the target's syntactic category.
     */
    public static boolean isCompatible(MutationLocation location, Node target, Node replacement) {
        if (!location.isRoot()) {
            return location.lastStep().slotType().isInstance(replacement);
        }
        return category(target).isInstance(replacement);
    }

    static Class<? extends Node> category(Node node) {
        for (Class<? extends Node> category : CATEGORIES) {
            if (category.isInstance(node)) {
                return category;
            }
        }
        return node.getClass();
    }

    private static boolean isChildProperty(PropertyMetaModel property) {
        return (property.isNode() || property.isNodeList())
                && !COMMENT_PROPERTY.equals(property.getName());
    }

    private static Optional<PropertyMetaModel> findProperty(Node node, String name) {
        return node.getMetaModel().getAllPropertyMetaModels().stream()
                .filter(p -> p.getName().equals(name))
                .filter(AstPaths::isChildProperty)
                .findFirst();
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Node> slotType(PropertyMetaModel property) {
        Class<?> type = property.getType();
        return Node.class.isAssignableFrom(type) ? (Class<? extends Node>) type : Node.class;
    }
}
