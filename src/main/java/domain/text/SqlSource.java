package domain.text;

/**
 * One unit of batch input: an id (used for the output file name), where it came from, and its text.
 */
public final class SqlSource {

    private final String id;
    private final SqlSourceKind kind;
    private final String origin;
    private final String text;

    public SqlSource(String id, SqlSourceKind kind, String origin, String text) {
        this.id = safe(id);
        this.kind = kind == null ? SqlSourceKind.FILE : kind;
        this.origin = safe(origin);
        this.text = text;
    }

    private static String safe(String s) {
        return s == null ? "" : s.trim();
    }

    public String getId() {
        return id;
    }

    public SqlSourceKind getKind() {
        return kind;
    }

    /** file path, or "file.csv#row" */
    public String getOrigin() {
        return origin;
    }

    /** SQL text, or JSON for {@link SqlSourceKind#AST_JSON}; may be null/blank */
    public String getText() {
        return text;
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
