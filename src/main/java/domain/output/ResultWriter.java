package domain.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;

import java.nio.file.Path;
import java.util.List;

/** Persists the per-source result report. */
public interface ResultWriter {

    void write(Path resultXlsx, List<FormatResult> results, List<FormatWarning> warnings);
}
