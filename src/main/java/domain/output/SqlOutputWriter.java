package domain.output;

import java.nio.file.Path;

/** Writes formatted SQL for one source. */
public interface SqlOutputWriter {
    void write(Path outDir, String sourceId, String sqlText);
}
