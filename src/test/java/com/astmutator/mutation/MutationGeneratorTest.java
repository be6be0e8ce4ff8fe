package com.astmutator.mutation;

import com.astmutator.mutation.errors.CallbackException;
import com.astmutator.mutation.errors.OperatorException;
import com.astmutator.mutation.operators.ArithmeticOperatorReplacement;
import com.astmutator.mutation.operators.MathOperator;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.EmptyStmt;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MutationGeneratorTest {

    /** Offers an unchanged copy of every expression, so each expression node yields exactly one mutation. */
    private static final MutationOperator COPY_EXPRESSIONS = node -> node instanceof Expression expr
            ? Stream.of(expr.clone())
            : Stream.empty();

    @Test
    void shouldReplaceEachMultiplicationInSourceOrder() {
        Expression root = StaticJavaParser.parseExpression("1 * 2 * 3");
        MutationGenerator generator = new MutationGenerator(
                List.of(new MathOperator()), new MutationApplier(), TraversalOrder.POST_ORDER);

        List<String> mutants = new ArrayList<>();
        GenerationReport report = generator.generate(root, (mutation, mutated) -> mutants.add(mutated.toString()));

        assertEquals(List.of("1 / 2 * 3", "1 * 2 / 3"), mutants);
        assertEquals(2, report.delivered());
        assertFalse(report.cancelled());
        assertEquals("1 * 2 * 3", root.toString());
    }

    @Test
    void shouldOfferOuterOperationFirstInPreOrder() {
        Expression root = StaticJavaParser.parseExpression("1 * 2 * 3");
        MutationGenerator generator = new MutationGenerator(List.of(new MathOperator()));

        List<String> mutants = new ArrayList<>();
        generator.generate(root, (mutation, mutated) -> mutants.add(mutated.toString()));

        assertEquals(List.of("1 * 2 / 3", "1 / 2 * 3"), mutants);
    }

    @Test
    void shouldYieldOneMutationPerNodeInPreOrder() {
        Expression root = StaticJavaParser.parseExpression("1 + 2 * 3");
        MutationGenerator generator = new MutationGenerator(List.of(COPY_EXPRESSIONS));

        List<String> targets = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        GenerationReport report = generator.discover(root, mutation -> {
            targets.add(mutation.getTarget().toString());
            ids.add(mutation.getId());
        });

        assertEquals(List.of("1 + 2 * 3", "1", "2 * 3", "2", "3"), targets);
        assertEquals(List.of(0, 1, 2, 3, 4), ids);
        assertEquals(5, report.visitedNodes());
        assertEquals(5, report.delivered());
    }

    @Test
    void shouldProduceSameDescriptorsOnEveryRun() {
        Node root = StaticJavaParser.parse("class A { int f(int a, int b) { return a * b - (a + b) % 2; } }");
        MutationGenerator generator = new MutationGenerator(List.of(new ArithmeticOperatorReplacement()));

        List<String> first = new ArrayList<>();
        generator.generate(root, (mutation, mutated) -> first.add(mutation.getId() + " " + mutation.getLocation()
                + " " + mutation.getReplacement()));
        List<String> second = new ArrayList<>();
        generator.generate(root, (mutation, mutated) -> second.add(mutation.getId() + " " + mutation.getLocation()
                + " " + mutation.getReplacement()));

        assertEquals(16, first.size());
        assertEquals(first, second);
    }

    @Test
    void shouldSurfaceEveryCandidateOfEveryOperatorAtTheSameNode() {
        Expression root = StaticJavaParser.parseExpression("a * b");
        MutationGenerator generator = new MutationGenerator(
                List.of(new ArithmeticOperatorReplacement(), new MathOperator()));

        List<String> mutants = new ArrayList<>();
        generator.generate(root, (mutation, mutated) ->
                mutants.add(mutation.getOperatorName() + ":" + mutated));

        assertEquals(List.of(
                "ArithmeticOperatorReplacement:a + b",
                "ArithmeticOperatorReplacement:a - b",
                "ArithmeticOperatorReplacement:a / b",
                "ArithmeticOperatorReplacement:a % b",
                "MathOperator:a / b"), mutants);
    }

    @Test
    void shouldOnlyTargetNodesOfTheOriginalTree() {
        Expression root = StaticJavaParser.parseExpression("f(1, 2)");
        Set<Node> original = Collections.newSetFromMap(new IdentityHashMap<>());
        root.walk(original::add);
        // every replacement contains new literals the traversal must not pick up
        MutationOperator grow = node -> node instanceof IntegerLiteralExpr literal
                ? Stream.of(new BinaryExpr(literal.clone(), new IntegerLiteralExpr("1"), BinaryExpr.Operator.PLUS))
                : Stream.empty();

        List<String> mutants = new ArrayList<>();
        new MutationGenerator(List.of(grow)).generate(root, (mutation, mutated) -> {
            assertTrue(original.contains(mutation.getTarget()));
            mutants.add(mutated.toString());
        });

        assertEquals(List.of("f(1 + 1, 2)", "f(1, 2 + 1)"), mutants);
    }

    @Test
    void shouldLeaveNodeOrderOfOriginalTreeUnchanged() {
        Expression root = StaticJavaParser.parseExpression("f(1 * 2, 3)");
        List<Node> before = root.findAll(Node.class);

        GenerationReport report = new MutationGenerator(List.of(new MathOperator()))
                .generate(root, (mutation, mutated) -> { });

        assertEquals(1, report.delivered());
        List<Node> after = root.findAll(Node.class);
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
            assertSame(before.get(i), after.get(i), "node " + i);
        }
        assertEquals("[f(1 * 2, 3), f, 1 * 2, 1, 2, 3]", after.toString());
    }

    @Test
    void shouldRejectCandidateThatIsStillAttached() {
        Expression root = StaticJavaParser.parseExpression("f(-x, -y)");
        MutationOperator unwrapWithoutCopy = node -> node instanceof UnaryExpr unary
                ? Stream.of(unary.getExpression())
                : Stream.empty();

        OperatorException e = assertThrows(OperatorException.class, () ->
                new MutationGenerator(List.of(unwrapWithoutCopy)).generate(root, (mutation, mutated) -> { }));

        assertEquals(0, e.getDeliveredCount());
        assertEquals("/arguments[0]", e.getLocation().toString());
        assertEquals("f(-x, -y)", root.toString());
    }

    @Test
    void shouldRejectTheVisitedNodeItselfAsCandidate() {
        Expression root = StaticJavaParser.parseExpression("a + b");
        MutationOperator identity = node -> node == root ? Stream.of(node) : Stream.empty();

        OperatorException e = assertThrows(OperatorException.class, () ->
                new MutationGenerator(List.of(identity)).discover(root, mutation -> { }));

        assertEquals(0, e.getDeliveredCount());
        assertTrue(e.getLocation().isRoot());
    }

    @Test
    void shouldStopAfterTwoDeliveriesWhenOperatorFailsOnThirdCandidate() {
        Expression root = StaticJavaParser.parseExpression("7");
        MutationOperator failing = node -> IntStream.range(0, 5).mapToObj(i -> {
            if (i == 2) {
                throw new IllegalStateException("boom");
            }
            return new IntegerLiteralExpr(String.valueOf(i));
        });
        List<String> delivered = new ArrayList<>();

        OperatorException e = assertThrows(OperatorException.class, () ->
                new MutationGenerator(List.of(failing)).generate(root,
                        (mutation, mutated) -> delivered.add(mutated.toString())));

        assertEquals(2, e.getDeliveredCount());
        assertEquals(List.of("0", "1"), delivered);
        assertTrue(e.getMessage().contains("2 delivered"));
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals("7", root.toString());
    }

    @Test
    void shouldRejectCandidateOfAnotherSyntacticCategory() {
        Expression root = StaticJavaParser.parseExpression("a + b");
        MutationOperator wrongCategory = node -> node instanceof BinaryExpr
                ? Stream.of(new EmptyStmt())
                : Stream.empty();

        OperatorException e = assertThrows(OperatorException.class, () ->
                new MutationGenerator(List.of(wrongCategory)).discover(root, mutation -> { }));

        assertEquals(0, e.getDeliveredCount());
        assertTrue(e.getLocation().isRoot());
    }

    @Test
    void shouldStopPromptlyWhenCancelledFromCallback() {
        Expression root = StaticJavaParser.parseExpression("1 + 2 + 3 + 4");
        AtomicInteger pulled = new AtomicInteger();
        MutationOperator counting = node -> new MathOperator().mutate(node).peek(candidate -> pulled.incrementAndGet());
        CancellationSignal signal = new CancellationSignal();
        List<String> mutants = new ArrayList<>();

        GenerationReport report = new MutationGenerator(List.of(counting)).generate(root, signal, (mutation, mutated) -> {
            mutants.add(mutated.toString());
            signal.cancel();
        });

        assertTrue(report.cancelled());
        assertEquals(1, report.delivered());
        assertEquals(1, pulled.get());
        assertEquals(List.of("1 + 2 + 3 - 4"), mutants);
        assertEquals("1 + 2 + 3 + 4", root.toString());
    }

    @Test
    void shouldRestoreTreeAndReportCountWhenCallbackFails() {
        Node root = StaticJavaParser.parse("class A { int f() { return 1 * 2 * 3; } }");
        Node pristine = root.clone();
        AtomicInteger calls = new AtomicInteger();

        CallbackException e = assertThrows(CallbackException.class, () ->
                new MutationGenerator(List.of(new MathOperator())).generate(root, (mutation, mutated) -> {
                    if (calls.incrementAndGet() == 2) {
                        throw new IOException("disk full");
                    }
                }));

        assertEquals(1, e.getDeliveredCount());
        assertEquals(1, e.getMutation().getId());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(pristine, root);
    }

    @Test
    void shouldLeaveTreeUntouchedInDiscoveryMode() {
        Expression root = StaticJavaParser.parseExpression("a < b && c > d");
        List<Mutation> found = new ArrayList<>();

        new MutationGenerator(List.of(new MathOperator(), COPY_EXPRESSIONS)).discover(root, mutation -> {
            assertSame(root, rootOf(mutation.getTarget()));
            found.add(mutation);
        });

        assertEquals(7, found.size());
        assertEquals("a < b && c > d", root.toString());
    }

    private static Node rootOf(Node node) {
        Node current = node;
        while (current.getParentNode().isPresent()) {
            current = current.getParentNode().get();
        }
        return current;
    }
}
