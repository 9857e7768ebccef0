package domain.output;

import java.util.Locale;

/**
 * File naming policy for formatted SQL.
 * <p>
 * {@code <sourceId>.sql}, with the source's own extension dropped and path separators
 * flattened:
 * queries/report.sql   -> queries_report.sql
 * orders.csv#Q12       -> orders.csv_Q12.sql
 */
public final class SqlFileNamePolicy {

    private static final String[] KNOWN_EXTENSIONS = {".sql", ".json"};

    private SqlFileNamePolicy() {
    }

    public static String build(String sourceId) {
        String id = sourceId == null ? "" : sourceId.trim();
        String lower = id.toLowerCase(Locale.ROOT);
        for (String ext : KNOWN_EXTENSIONS) {
            if (lower.endsWith(ext) && id.length() > ext.length()) {
                id = id.substring(0, id.length() - ext.length());
                break;
            }
        }
        id = id.replace('/', '_').replace('\\', '_');
        id = safePart(id, "unknownSource");
        return limit(id, 180) + ".sql";
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
