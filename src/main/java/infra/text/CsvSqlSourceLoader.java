package infra.text;

import domain.text.SqlSource;
import domain.text.SqlSourceKind;
import domain.text.SqlSourceLoader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads SQL rows from a CSV export (UTF-8, BOM tolerated).
 *
 * <p>The first record is read as the header by hand so that blank or duplicated header cells
 * do not fail the parse. Recognized columns (case/space/underscore-insensitive):</p>
 * <ul>
 *   <li>id: {@code id}, {@code sql_id}, {@code name}; falls back to the row number</li>
 *   <li>text: {@code sql_text}, {@code sql}, {@code query}</li>
 * </ul>
 */
public final class CsvSqlSourceLoader implements SqlSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvSqlSourceLoader.class);

    private static final String[] ID_HEADERS = {"id", "sql_id", "sqlid", "name"};
    private static final String[] TEXT_HEADERS = {"sql_text", "sqltext", "sql", "query"};

    @Override
    public List<SqlSource> load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.isRegularFile(csvPath)) throw new IllegalArgumentException("csv not found: " + csvPath);

        String fileName = csvPath.getFileName().toString();
        try (Reader reader = new InputStreamReader(Files.newInputStream(csvPath), StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            CSVRecord headerRec = it.next();
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                String h = SourceFiles.stripBom(safe(headerRec.get(i))).trim();
                if (h.isBlank()) h = "COL_" + (i + 1);
                headerIndex.putIfAbsent(norm(h), i);
            }

            Integer textIdx = find(headerIndex, TEXT_HEADERS);
            if (textIdx == null) {
                throw new IllegalArgumentException("csv has no sql column (sql_text/sql/query): " + csvPath);
            }
            Integer idIdx = find(headerIndex, ID_HEADERS);

            List<SqlSource> out = new ArrayList<>(1024);
            int rowNo = 1;
            while (it.hasNext()) {
                CSVRecord r = it.next();
                rowNo++;
                String text = cell(r, textIdx);
                String id = cell(r, idIdx);
                if (text.isBlank() && id.isBlank()) continue;
                if (id.isBlank()) id = "row" + rowNo;

                out.add(new SqlSource(id, SqlSourceKind.CSV, fileName + "#" + rowNo, text));
            }
            log.debug("Loaded {} rows from {}", out.size(), csvPath);
            return out;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load csv: " + csvPath, e);
        }
    }

    private static Integer find(Map<String, Integer> headerIndex, String... candidates) {
        for (String c : candidates) {
            Integer i = headerIndex.get(norm(c));
            if (i != null) return i;
        }
        return null;
    }

    private static String cell(CSVRecord r, Integer idx) {
        if (idx == null || idx < 0 || idx >= r.size()) return "";
        return safe(r.get(idx));
    }

    private static String norm(String s) {
        if (s == null) return "";
        return s.trim()
                .toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "")
                .replace("-", "");
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
