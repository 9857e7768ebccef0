package infra.text;

import domain.text.SqlSource;
import domain.text.SqlSourceKind;
import domain.text.SqlSourceLoader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads {@code .sql} files: one source per file, id = path relative to the input directory.
 */
public final class SqlFileSourceLoader implements SqlSourceLoader {

    @Override
    public List<SqlSource> load(Path location) {
        List<SqlSource> out = new ArrayList<>();
        for (Path file : SourceFiles.scan(location, ".sql")) {
            out.add(new SqlSource(
                    SourceFiles.relativeId(location, file),
                    SqlSourceKind.FILE,
                    file.toString(),
                    SourceFiles.read(file)));
        }
        return out;
    }
}
