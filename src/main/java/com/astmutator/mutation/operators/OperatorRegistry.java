package com.astmutator.mutation.operators;

import com.astmutator.mutation.MutationOperator;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class OperatorRegistry {

    private static final Map<OperatorKind, MutationOperator> OPERATORS = Map.ofEntries(
            Map.entry(OperatorKind.MATH,                  new MathOperator()),
            Map.entry(OperatorKind.AOR,                   new ArithmeticOperatorReplacement()),
            Map.entry(OperatorKind.ROR,                   new RelationalOperatorReplacement()),
            Map.entry(OperatorKind.CONDITIONALS_BOUNDARY, new ConditionalsBoundaryOperator()),
            Map.entry(OperatorKind.NEGATE_CONDITIONALS,   new NegateConditionalsOperator()),
            Map.entry(OperatorKind.LOGICAL_CONNECTOR,     new LogicalConnectorReplacement()),
            Map.entry(OperatorKind.BOOLEAN_LITERAL,       new BooleanLiteralOperator()),
            Map.entry(OperatorKind.INCREMENTS,            new IncrementsOperator()),
            Map.entry(OperatorKind.INVERT_NEGATIVES,      new InvertNegativesOperator()),
            Map.entry(OperatorKind.INLINE_CONSTANT,       new InlineConstantOperator()),
            Map.entry(OperatorKind.STRING_LITERAL,        new StringLiteralOperator()),
            Map.entry(OperatorKind.DATE_FORMAT,           new DateFormatPatternOperator()),
            Map.entry(OperatorKind.LOOP_BREAK,            new LoopBreakOperator()),
            Map.entry(OperatorKind.STREAM_METHOD,         new StreamMethodOperator()),
            Map.entry(OperatorKind.OPTIONAL_METHOD,       new OptionalMethodOperator()),
            Map.entry(OperatorKind.ASSERTION_METHOD,      new AssertionMethodOperator())
    );

    /** Expose the enum→operator map */
    public Map<OperatorKind, MutationOperator> getRegisteredOperators() {
        return OPERATORS;
    }

    public MutationOperator get(OperatorKind kind) {
        return OPERATORS.get(kind);
    }

    /**
     * Operators for the given kinds, in the order given and without duplicates.
     * An empty selection means every operator, in declaration order of {@link OperatorKind}.
     */
    public List<MutationOperator> select(Collection<OperatorKind> kinds) {
        Collection<OperatorKind> selected = kinds == null || kinds.isEmpty()
                ? Arrays.asList(OperatorKind.values())
                : new LinkedHashSet<>(kinds);
        return selected.stream()
                .map(OPERATORS::get)
                .collect(Collectors.toList());
    }
}
