package domain.parse;

/**
 * The parse boundary rejected its input (SQL text or AST JSON).
 */
public class SqlParseException extends RuntimeException {

    public SqlParseException(String message) {
        super(message);
    }

    public SqlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
