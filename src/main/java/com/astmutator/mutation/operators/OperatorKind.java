package com.astmutator.mutation.operators;

public enum OperatorKind {
    MATH,
    AOR,
    ROR,
    CONDITIONALS_BOUNDARY,
    NEGATE_CONDITIONALS,
    LOGICAL_CONNECTOR,
    BOOLEAN_LITERAL,
    INCREMENTS,
    INVERT_NEGATIVES,
    INLINE_CONSTANT,
    STRING_LITERAL,
    DATE_FORMAT,
    LOOP_BREAK,
    STREAM_METHOD,
    OPTIONAL_METHOD,
    ASSERTION_METHOD
}
