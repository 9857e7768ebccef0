package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListFormatWarningSinkTest {

    @Test
    void duplicates_are_dropped_and_counted_once() {
        List<FormatWarning> out = new ArrayList<>();
        ListFormatWarningSink sink = new ListFormatWarningSink(out);

        sink.warn(FormatWarning.of(WarningCode.UNSUPPORTED_EXPRESSION, "q1", "x"));
        sink.warn(FormatWarning.of(WarningCode.UNSUPPORTED_EXPRESSION, "q1", "x"));
        sink.warn(FormatWarning.of(WarningCode.UNSUPPORTED_EXPRESSION, "q2", "x"));
        sink.warn(FormatWarning.of(WarningCode.PARSE_FAILED, "q3", "bad"));
        sink.warn(null);

        assertEquals(3, out.size());
        assertEquals(Map.of(WarningCode.UNSUPPORTED_EXPRESSION, 2, WarningCode.PARSE_FAILED, 1), sink.countsByCode());
    }

    @Test
    void source_sink_stamps_the_source_id() {
        List<FormatWarning> out = new ArrayList<>();
        SourceWarningSink sink = new SourceWarningSink(new ListFormatWarningSink(out), "orders.sql");

        sink.warn(FormatWarning.of(WarningCode.MALFORMED_CLAUSE, null, "WITH"));

        assertEquals("orders.sql", out.get(0).getSourceId());
        assertEquals(1, sink.getCount());
    }
}
