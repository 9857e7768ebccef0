package domain.model;

/**
 * A single warning emitted during formatting.
 *
 * <p>Warnings are not fatal; the formatter always produces text. They point at
 * output that operators may want to review.</p>
 */
public final class FormatWarning {

    private final WarningCode code;
    private final String sourceId;
    private final String message;
    private final String detail;

    public FormatWarning(WarningCode code, String sourceId, String message, String detail) {
        this.code = code == null ? WarningCode.FORMAT_ERROR : code;
        this.sourceId = nullToEmpty(sourceId);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FormatWarning of(WarningCode code, String sourceId, String message) {
        return new FormatWarning(code, sourceId, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Copy of this warning attributed to the given source.
     */
    public FormatWarning withSourceId(String sourceId) {
        return new FormatWarning(code, sourceId, message, detail);
    }

    public WarningCode getCode() {
        return code;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
