package domain.text;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads batch SQL sources from a file or directory.
 */
public interface SqlSourceLoader {
    List<SqlSource> load(Path location);
}
