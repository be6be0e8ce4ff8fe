package com.astmutator.mutation;

import com.astmutator.mutation.AstPaths.Child;
import com.astmutator.mutation.MutationLocation.Step;
import com.astmutator.mutation.errors.LocationNotFoundException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.LineComment;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.EmptyStmt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstPathsTest {

    @Test
    void shouldListChildrenInSourceOrder() {
        MethodCallExpr call = StaticJavaParser.parseExpression("foo(a, b)");

        List<String> steps = AstPaths.children(call).stream()
                .map(child -> child.step().toString())
                .collect(Collectors.toList());

        assertEquals(List.of("name", "arguments[0]", "arguments[1]"), steps);
    }

    @Test
    void shouldNotTreatCommentsAsChildren() {
        NameExpr name = new NameExpr("x");
        name.setComment(new LineComment("note"));

        List<Child> children = AstPaths.children(name);

        assertEquals(1, children.size());
        assertEquals("name", children.get(0).step().property());
    }

    @Test
    void shouldKeepChildOrderAfterSlotReplacement() {
        BinaryExpr sum = StaticJavaParser.parseExpression("a + b");
        List<Child> before = AstPaths.children(sum);

        NameExpr replacement = new NameExpr("c");
        sum.getLeft().getRange().ifPresent(replacement::setRange);
        sum.getLeft().replace(replacement);

        List<Child> after = AstPaths.children(sum);
        assertEquals(before.stream().map(Child::step).collect(Collectors.toList()),
                after.stream().map(Child::step).collect(Collectors.toList()));
    }

    @Test
    void shouldResolveLocationToTheSameNode() {
        CompilationUnit unit = StaticJavaParser.parse("class A { int f() { return g(1, 2 * 3); } }");
        Expression target = unit.findFirst(BinaryExpr.class).orElseThrow();

        MutationLocation location = locate(unit, target, MutationLocation.root());

        assertSame(target, AstPaths.resolve(unit, location));
        assertTrue(location.toString().endsWith("/arguments[1]"));
    }

    @Test
    void shouldFailOnMissingListElement() {
        MethodCallExpr call = StaticJavaParser.parseExpression("foo(a)");
        MutationLocation location = MutationLocation.root().child(Step.element("arguments", 3, Expression.class));

        LocationNotFoundException e = assertThrows(LocationNotFoundException.class,
                () -> AstPaths.resolve(call, location));
        assertSame(location, e.getLocation());
    }

    @Test
    void shouldFailOnUnknownProperty() {
        MethodCallExpr call = StaticJavaParser.parseExpression("foo(a)");
        MutationLocation location = MutationLocation.root().child(Step.single("left", Expression.class));

        assertThrows(LocationNotFoundException.class, () -> AstPaths.resolve(call, location));
    }

    @Test
    void shouldFailOnEmptySlot() {
        MethodCallExpr call = StaticJavaParser.parseExpression("foo(a)");
        MutationLocation location = MutationLocation.root().child(Step.single("scope", Expression.class));

        assertThrows(LocationNotFoundException.class, () -> AstPaths.resolve(call, location));
    }

    @Test
    void shouldCheckReplacementAgainstSlotType() {
        BinaryExpr sum = StaticJavaParser.parseExpression("a + b");
        Child left = AstPaths.children(sum).get(0);
        MutationLocation location = MutationLocation.root().child(left.step());

        assertTrue(AstPaths.isCompatible(location, left.node(), new NameExpr("c")));
        assertFalse(AstPaths.isCompatible(location, left.node(), new EmptyStmt()));
        assertTrue(AstPaths.isCompatible(MutationLocation.root(), sum, new NameExpr("c")));
        assertFalse(AstPaths.isCompatible(MutationLocation.root(), sum, new EmptyStmt()));
    }

    private static MutationLocation locate(Node node, Expression target, MutationLocation at) {
        if (node == target) {
            return at;
        }
        for (Child child : AstPaths.children(node)) {
            MutationLocation found = locate(child.node(), target, at.child(child.step()));
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
