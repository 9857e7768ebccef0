package domain.model;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|sourceId|message|detail) so the same unsupported node
 * hit repeatedly inside one statement yields a single row.</p>
 */
public final class ListFormatWarningSink implements FormatWarningSink {

    private final List<FormatWarning> target;
    private final Set<String> seen = new HashSet<>(256);
    private final Map<WarningCode, Integer> counts = new EnumMap<>(WarningCode.class);

    public ListFormatWarningSink(List<FormatWarning> target) {
        this.target = target;
    }

    private static String key(FormatWarning w) {
        return w.getCode().name() + "|" + w.getSourceId() + "|" + w.getMessage() + "|" + w.getDetail();
    }

    @Override
    public void warn(FormatWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
            counts.merge(warning.getCode(), 1, Integer::sum);
        }
    }

    /** Kept (de-duplicated) warnings per code, in enum order. */
    public Map<WarningCode, Integer> countsByCode() {
        return new EnumMap<>(counts);
    }
}
