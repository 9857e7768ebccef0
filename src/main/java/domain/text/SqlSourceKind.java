package domain.text;

/**
 * Where a batch SQL source was loaded from.
 * <ul>
 *   <li>{@link #FILE}: one .sql file (may hold several statements)</li>
 *   <li>{@link #CSV}: one row of a CSV with an sql_text column</li>
 *   <li>{@link #AST_JSON}: a pre-parsed AST in node-sql-parser JSON; rendered without parsing</li>
 * </ul>
 */
public enum SqlSourceKind {
    FILE,
    CSV,
    AST_JSON
}
