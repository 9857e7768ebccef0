package domain.model;

/**
 * Decorator that attributes every warning to one source id before forwarding it.
 *
 * <p>The renderer does not know which file or CSV row it is formatting; the batch
 * loop wraps its sink with this per source.</p>
 */
public final class SourceWarningSink implements FormatWarningSink {

    private final FormatWarningSink delegate;
    private final String sourceId;
    private int count;

    public SourceWarningSink(FormatWarningSink delegate, String sourceId) {
        this.delegate = delegate == null ? FormatWarningSink.none() : delegate;
        this.sourceId = sourceId;
    }

    @Override
    public void warn(FormatWarning warning) {
        if (warning == null) return;
        count++;
        delegate.warn(warning.withSourceId(sourceId));
    }

    /** Number of warnings seen for this source (before de-duplication). */
    public int getCount() {
        return count;
    }
}
