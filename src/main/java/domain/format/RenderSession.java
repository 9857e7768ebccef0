package domain.format;

import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-call render state: options, layout, warning sink and the nesting depth counter.
 *
 * <p>One instance per {@link StatementRenderer#render} call; never shared between threads.</p>
 */
final class RenderSession {

    private static final Logger log = LoggerFactory.getLogger(RenderSession.class);

    static final String NESTING_PLACEHOLDER = "/* nesting too deep */";

    private final FormatterOptions options;
    private final SelectLayout layout;
    private final FormatWarningSink warnings;
    private int depth;
    private boolean depthReported;

    RenderSession(FormatterOptions options, SelectLayout layout, FormatWarningSink warnings) {
        this.options = options == null ? FormatterOptions.defaults() : options;
        this.layout = layout == null ? SelectLayout.STANDARD : layout;
        this.warnings = warnings == null ? FormatWarningSink.none() : warnings;
    }

    SelectLayout layout() {
        return layout;
    }

    String keyword(String kw) {
        return options.getKeywordCase().apply(kw);
    }

    /** Keyword right-aligned to the gutter. */
    String gutter(String kw, int width) {
        return TextLayout.padStart(keyword(kw), width);
    }

    /**
     * Enters one nesting level.
     *
     * @return false when the configured depth is exceeded; the caller must not recurse and must not call {@link #exit()}
     */
    boolean enter() {
        if (depth >= options.getMaxNestingDepth()) {
            if (!depthReported) {
                depthReported = true;
                log.warn("Nesting deeper than {} levels; subtree replaced by a placeholder", options.getMaxNestingDepth());
                warn(WarningCode.NESTING_TOO_DEEP, "nesting deeper than " + options.getMaxNestingDepth(), null);
            }
            return false;
        }
        depth++;
        return true;
    }

    void exit() {
        depth = Math.max(0, depth - 1);
    }

    void warn(WarningCode code, String message, String detail) {
        warnings.warn(new FormatWarning(code, null, message, detail));
    }
}
