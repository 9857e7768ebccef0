package domain.format;

/**
 * Structural role of an {@link IndentContext}.
 */
public enum ContextKind {
    MAIN(0),
    SELECT_CLAUSE(1),
    WHERE_CLAUSE(1),
    CASE_WHEN(3),
    FUNCTION_ARG(1),
    SUBQUERY(1),
    JOIN_CONDITION(0);

    private final int adjustment;

    ContextKind(int adjustment) {
        this.adjustment = adjustment;
    }

    /** Extra columns added to the nesting indent. */
    public int adjustment() {
        return adjustment;
    }
}
