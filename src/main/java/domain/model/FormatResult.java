package domain.model;

/**
 * A single formatting outcome row for reporting.
 *
 * <p>Kept as a simple value object (no behavior) so it can be reused by CLI/API layers.</p>
 */
public final class FormatResult {

    public static final String STATUS_FORMATTED = "FORMATTED";
    public static final String STATUS_UNCHANGED = "UNCHANGED";
    public static final String STATUS_SKIP = "SKIP";
    public static final String STATUS_ERROR = "ERROR";

    private final String status;
    private final String sourceId;

    /**
     * FILE / CSV / AST_JSON
     */
    private final String sourceKind;

    /**
     * file path or csv location the SQL came from
     */
    private final String origin;
    private final String message;
    private final int warningCount;
    private final long elapsedMs;

    /**
     * optional detail (exception class, parser message); may be null on success
     */
    private final String detail;

    public FormatResult(String status, String sourceId, String sourceKind, String origin, String message) {
        this(status, sourceId, sourceKind, origin, message, 0, 0L, null);
    }

    public FormatResult(
            String status,
            String sourceId,
            String sourceKind,
            String origin,
            String message,
            int warningCount,
            long elapsedMs,
            String detail
    ) {
        this.status = nullToEmpty(status);
        this.sourceId = nullToEmpty(sourceId);
        this.sourceKind = nullToEmpty(sourceKind);
        this.origin = nullToEmpty(origin);
        this.message = nullToEmpty(message);
        this.warningCount = Math.max(0, warningCount);
        this.elapsedMs = Math.max(0L, elapsedMs);
        this.detail = nullToNullIfBlank(detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String nullToNullIfBlank(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String getStatus() {
        return status;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourceKind() {
        return sourceKind;
    }

    public String getOrigin() {
        return origin;
    }

    public String getMessage() {
        return message;
    }

    public int getWarningCount() {
        return warningCount;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getDetail() {
        return detail;
    }
}
