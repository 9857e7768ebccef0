package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (--noResult).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<FormatResult> results, List<FormatWarning> warnings) {
        // intentionally no-op
    }
}
