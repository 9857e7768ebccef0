package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores formatted SQL into files.
 * <p>
 * Output layout: {@code <outDir>/<SqlFileNamePolicy.build(sourceId)>}, UTF-8, newline-terminated.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path outDir, String sourceId, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir, e);
        }

        Path target = outDir.resolve(SqlFileNamePolicy.build(sourceId));
        String text = sqlText == null ? "" : sqlText;
        if (!text.endsWith("\n")) text = text + "\n";
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write SQL file: " + target, e);
        }
    }
}
