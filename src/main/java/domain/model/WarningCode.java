package domain.model;

/**
 * Standard warning codes for formatting/reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * SQL text is empty and the source is skipped.
     */
    SQL_TEXT_EMPTY,

    /**
     * The parser rejected the SQL text; the original text was kept.
     */
    PARSE_FAILED,

    /**
     * Statement kind has no renderer (e.g. DDL); the original text was kept.
     */
    UNSUPPORTED_STATEMENT,

    /**
     * Expression node was not recognized and was emitted as-is or as a placeholder comment.
     */
    UNSUPPORTED_EXPRESSION,

    /**
     * Clause payload did not have the expected shape (e.g. WITH is not a list).
     */
    MALFORMED_CLAUSE,

    /**
     * Function/table/column name could not be resolved from any known encoding.
     */
    UNRESOLVED_NAME,

    /**
     * Nesting exceeded the configured depth; the subtree was replaced by a comment.
     */
    NESTING_TOO_DEEP,

    /**
     * Formatting failed with an exception.
     */
    FORMAT_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_SQL
}
