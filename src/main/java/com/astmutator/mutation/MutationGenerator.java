package com.astmutator.mutation;

import com.astmutator.mutation.AstPaths.Child;
import com.astmutator.mutation.errors.CallbackException;
import com.astmutator.mutation.errors.OperatorException;
import com.github.javaparser.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Walks a tree depth-first and offers every node to every operator. Each candidate the
 * operators yield is turned into a {@link Mutation} and pushed to the caller before the
 * next candidate is pulled.
 * <p>
 * The traversal only ever follows the original tree. Mutated trees exist while a callback
 * runs and are never walked, so no mutation is derived from another one.
 */
public class MutationGenerator {
    private static final Logger log = LoggerFactory.getLogger(MutationGenerator.class);

    private final List<MutationOperator> operators;
    private final MutationApplier applier;
    private final TraversalOrder order;

    public MutationGenerator(List<? extends MutationOperator> operators) {
        this(operators, new MutationApplier(), TraversalOrder.PRE_ORDER);
    }

    public MutationGenerator(List<? extends MutationOperator> operators,
                             MutationApplier applier,
                             TraversalOrder order) {
        this.operators = List.copyOf(operators);
        this.applier = applier;
        this.order = order;
    }

    public List<MutationOperator> getOperators() {
        return operators;
    }

    public TraversalOrder getOrder() {
        return order;
    }

    public GenerationReport generate(Node root, MutationCallback callback) {
        return generate(root, new CancellationSignal(), callback);
    }

    /**
     * Applies each discovered mutation to {@code root} in turn and passes the mutated tree to
     * {@code callback}. The tree is restored after every callback.
     *
     * @throws OperatorException if an operator fails; earlier callbacks have completed
     * @throws CallbackException if the callback fails; the tree has been restored
     */
    public GenerationReport generate(Node root, CancellationSignal signal, MutationCallback callback) {
        return run(root, signal, mutation -> applier.apply(root, mutation, callback));
    }

    public GenerationReport discover(Node root, MutationListener listener) {
        return discover(root, new CancellationSignal(), listener);
    }

    /**
     * Reports each discovered mutation without applying it.
     */
    public GenerationReport discover(Node root, CancellationSignal signal, MutationListener listener) {
        return run(root, signal, mutation -> {
            try {
                listener.onMutation(mutation);
            } catch (Exception e) {
                throw new CallbackException(mutation, e);
            }
        });
    }

    private GenerationReport run(Node root, CancellationSignal signal, Consumer<Mutation> sink) {
        Run run = new Run(signal, sink);
        visit(root, MutationLocation.root(), run);
        log.debug("Generated {} mutation(s) over {} node(s){}",
                run.delivered, run.visited, run.stopped() ? " (cancelled)" : "");
        return new GenerationReport(run.delivered, run.visited, run.stopped());
    }

    private void visit(Node node, MutationLocation location, Run run) {
        if (run.stopped()) {
            return;
        }
        run.visited++;
        List<Child> children = AstPaths.children(node);
        if (order == TraversalOrder.PRE_ORDER) {
            offer(node, location, run);
        }
        for (Child child : children) {
            if (run.stopped()) {
                return;
            }
            visit(child.node(), location.child(child.step()), run);
        }
        if (order == TraversalOrder.POST_ORDER && !run.stopped()) {
            offer(node, location, run);
        }
    }

    private void offer(Node node, MutationLocation location, Run run) {
        for (MutationOperator operator : operators) {
            if (run.stopped()) {
                return;
            }
            try (Stream<? extends Node> candidates = candidates(operator, node, location, run)) {
                Iterator<? extends Node> it = candidates.iterator();
                while (!run.stopped()) {
                    Node replacement = pull(it, operator, location, run);
                    if (replacement == null) {
                        break;
                    }
                    if (replacement == node || replacement.getParentNode().isPresent()) {
                        throw new OperatorException(operator.name(), location, run.delivered,
                                "yielded a node that is already attached to a tree");
                    }
                    if (!AstPaths.isCompatible(location, node, replacement)) {
                        throw new OperatorException(operator.name(), location, run.delivered,
                                replacement.getMetaModel().getTypeName() + " cannot replace "
                                        + node.getMetaModel().getTypeName());
                    }
                    deliver(new Mutation(run.nextId++, location, node, replacement, operator.name()), run);
                }
            }
        }
    }

    private Stream<? extends Node> candidates(MutationOperator operator, Node node, MutationLocation location, Run run) {
        Stream<? extends Node> candidates;
        try {
            candidates = operator.mutate(node);
        } catch (RuntimeException e) {
            throw new OperatorException(operator.name(), location, run.delivered, e);
        }
        if (candidates == null) {
            throw new OperatorException(operator.name(), location, run.delivered, "returned no stream");
        }
        return candidates;
    }

    /** Next candidate, or {@code null} when the operator is exhausted. */
    private Node pull(Iterator<? extends Node> it, MutationOperator operator, MutationLocation location, Run run) {
        Node next;
        try {
            if (!it.hasNext()) {
                return null;
            }
            next = it.next();
        } catch (RuntimeException e) {
            throw new OperatorException(operator.name(), location, run.delivered, e);
        }
        if (next == null) {
            throw new OperatorException(operator.name(), location, run.delivered, "yielded a null candidate");
        }
        return next;
    }

    private void deliver(Mutation mutation, Run run) {
        try {
            run.sink.accept(mutation);
        } catch (CallbackException e) {
            throw e.withDeliveredCount(run.delivered);
        }
        run.delivered++;
    }

    private static final class Run {
        final CancellationSignal signal;
        final Consumer<Mutation> sink;
        int nextId;
        int delivered;
        int visited;

        Run(CancellationSignal signal, Consumer<Mutation> sink) {
            this.signal = signal;
            this.sink = sink;
        }

        boolean stopped() {
            return signal.isCancelled();
        }
    }
}
