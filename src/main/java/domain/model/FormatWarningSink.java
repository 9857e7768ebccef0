package domain.model;

/**
 * Sink for formatting warnings.
 *
 * <p>Warnings come from the renderer, the parser adapters and the batch loop.
 * A sink lets them be collected without coupling the renderer to the CLI or the XLSX writer.</p>
 */
public interface FormatWarningSink {

    static FormatWarningSink none() {
        return NullFormatWarningSink.INSTANCE;
    }

    void warn(FormatWarning warning);
}
