package domain.format;

/**
 * Statement kind has no renderer. Raised to the orchestrator, which keeps the original text.
 */
public class UnsupportedStatementException extends RuntimeException {

    private final String statementKind;

    public UnsupportedStatementException(String statementKind) {
        super("Unsupported statement type: " + statementKind);
        this.statementKind = statementKind;
    }

    public String getStatementKind() {
        return statementKind;
    }
}
