package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Rewrites date/time format patterns passed to {@code DateTimeFormatter.ofPattern},
 * {@code SimpleDateFormat} and friends, swapping letters that are easy to confuse
 * ({@code yyyy}/{@code YYYY}, {@code MM}/{@code mm}, ...). Each applicable swap is a
 * separate candidate.
 */
public class DateFormatPatternOperator implements MutationOperator {

    private static final Set<String> PATTERN_METHODS = Set.of("ofPattern", "applyPattern", "applyLocalizedPattern");
    private static final Set<String> PATTERN_TYPES = Set.of("SimpleDateFormat", "java.text.SimpleDateFormat");

    private static final List<Swap> SWAPS = List.of(
            new Swap("yyyy", "YYYY"),   // year vs week-based year
            new Swap("YYYY", "yyyy"),
            new Swap("MM", "mm"),       // month vs minute
            new Swap("mm", "MM"),
            new Swap("dd", "DD"),       // day of month vs day of year
            new Swap("DD", "dd"),
            new Swap("HH", "hh"),       // 24h vs 12h clock
            new Swap("hh", "HH")
    );

    private record Swap(String from, String to) {
    }

    @Override
    public Stream<StringLiteralExpr> mutate(Node node) {
        if (!(node instanceof StringLiteralExpr literal) || !isFormatPattern(literal)) {
            return Stream.empty();
        }
        String pattern = literal.getValue();
        return SWAPS.stream()
                .filter(swap -> pattern.contains(swap.from()))
                .map(swap -> {
                    StringLiteralExpr rewritten = Replacements.copyOf(literal);
                    rewritten.setValue(pattern.replace(swap.from(), swap.to()));
                    return rewritten;
                });
    }

    private boolean isFormatPattern(StringLiteralExpr literal) {
        Node parent = literal.getParentNode().orElse(null);
        if (parent instanceof MethodCallExpr call) {
            return PATTERN_METHODS.contains(call.getNameAsString())
                    && call.getArguments().stream().anyMatch(arg -> arg == literal);
        }
        if (parent instanceof ObjectCreationExpr creation) {
            return PATTERN_TYPES.contains(creation.getType().asString())
                    && creation.getArguments().stream().anyMatch(arg -> arg == literal);
        }
        return false;
    }
}
