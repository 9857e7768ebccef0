package infra.text;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * File-system helpers shared by the source loaders.
 */
final class SourceFiles {

    private SourceFiles() {
    }

    /**
     * A single file is returned as-is; a directory is walked for files with the given
     * extension, sorted by path.
     */
    static List<Path> scan(Path location, String extension) {
        if (location == null) throw new IllegalArgumentException("location is null");
        if (!Files.exists(location)) throw new IllegalArgumentException("input not found: " + location);
        if (Files.isRegularFile(location)) return List.of(location);

        String ext = extension.toLowerCase(Locale.ROOT);
        List<Path> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(location)) {
            s.filter(p -> Files.isRegularFile(p))
                    .filter(p -> p.getFileName()
                            .toString()
                            .toLowerCase(Locale.ROOT)
                            .endsWith(ext))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan " + ext + " files under: " + location, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    /** Path of {@code file} relative to the scan root, '/'-separated; the file name for a single file. */
    static String relativeId(Path root, Path file) {
        if (root.equals(file) || !Files.isDirectory(root)) return file.getFileName().toString();
        return root.relativize(file).toString().replace('\\', '/');
    }

    static String read(Path file) {
        try {
            return stripBom(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read: " + file, e);
        }
    }

    static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
