package org.learningjava.flowc.domain.service.translate;

/**
 * Kinds of Flow lines in dispatch order. {@link #rank()} is the priority group: a line that
 * fits several groups is always taken by the lowest rank.
 */
public enum RuleKind {
    ENTRY_HEADER(1),
    FUNCTION_HEADER(1),
    STRUCT_HEADER(3),
    STRUCT_FIELD(3),
    STRUCT_METHOD(4),
    SAY_TEXT(5),
    SAY_EXPRESSION(5),
    PRINT_TEXT(5),
    PRINT_EXPRESSION(5),
    TEXT_BINDING(6),
    DECIMAL_BINDING(6),
    INTEGER_BINDING(6),
    BOOLEAN_BINDING(6),
    LIST_BINDING(6),
    MUTABLE_BINDING(6),
    GENERIC_BINDING(6),
    REASSIGNMENT(7),
    RETURN_VALUE(8),
    RETURN(8),
    IF(9),
    ELSE_IF(9),
    ELSE(9),
    FOR_RANGE(10),
    FOR_EACH(10),
    REPEAT(10),
    WHILE(10),
    SKIP(10),
    STOP(10),
    PAUSE(11),
    WRITE_FILE(12),
    READ_FILE(12),
    ASK(13),
    SQRT(14),
    ABS(14),
    POW(14),
    RANDOM(15),
    CALL(16),
    BARE_CALL(17),
    FALLBACK(18);

    private final int rank;

    RuleKind(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
