package domain.format;

/**
 * Orchestrator output.
 *
 * @param text          formatted text, or the original text when {@code formatted} is false
 * @param formatted     false when parsing/rendering failed and the input was kept
 * @param failureReason message of the failure; null on success
 */
public record FormattedSql(String text, boolean formatted, String failureReason) {

    static FormattedSql ok(String text) {
        return new FormattedSql(text, true, null);
    }

    static FormattedSql unchanged(String original, String reason) {
        return new FormattedSql(original, false, reason);
    }
}
