package domain.format;

import domain.ast.SqlStatement;
import domain.text.SqlStatementSplitter;

/**
 * How a multi-column SELECT list starts.
 */
public enum SelectLayout {
    /** keyword alone, first column on the next line */
    STANDARD,
    /** keyword and first column on one line */
    COMPACT;

    /** COMPACT when the statement text begins with WITH, STANDARD otherwise. */
    public static SelectLayout detect(String statementText) {
        return "WITH".equals(SqlStatementSplitter.leadingKeyword(statementText)) ? COMPACT : STANDARD;
    }

    /** Same rule for statements that did not come from text. */
    public static SelectLayout of(SqlStatement statement) {
        if (statement instanceof SqlStatement.SelectStatement s && s.with() != null) return COMPACT;
        return STANDARD;
    }
}
