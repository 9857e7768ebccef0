package infra.text;

import domain.text.SqlSource;
import domain.text.SqlSourceKind;
import domain.text.SqlSourceLoader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads pre-parsed AST documents ({@code .json}); the JSON is parsed later by the AST reader.
 */
public final class AstJsonSourceLoader implements SqlSourceLoader {

    @Override
    public List<SqlSource> load(Path location) {
        List<SqlSource> out = new ArrayList<>();
        for (Path file : SourceFiles.scan(location, ".json")) {
            out.add(new SqlSource(
                    SourceFiles.relativeId(location, file),
                    SqlSourceKind.AST_JSON,
                    file.toString(),
                    SourceFiles.read(file)));
        }
        return out;
    }
}
