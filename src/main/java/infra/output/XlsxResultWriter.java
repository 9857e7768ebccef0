package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per source (FORMATTED/UNCHANGED/SKIP/ERROR)</li>
 *   <li>warnings: non-fatal warnings by code</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    static final String[] RESULT_HEADER = {
            "status", "sourceId", "sourceKind", "origin", "message", "warningCount", "elapsedMs", "detail"
    };
    static final String[] WARNING_HEADER = {"code", "sourceId", "message", "detail"};

    // Excel rejects cell text longer than this
    private static final int MAX_CELL_CHARS = 32_767;

    @Override
    public void write(Path resultXlsx, List<FormatResult> results, List<FormatWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }

    private static void writeResultSheet(Workbook wb, List<FormatResult> results) {
        Sheet sh = wb.createSheet("result");
        int r = 0;
        header(sh.createRow(r++), RESULT_HEADER);

        for (FormatResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(cell(it.getStatus()));
            row.createCell(1).setCellValue(cell(it.getSourceId()));
            row.createCell(2).setCellValue(cell(it.getSourceKind()));
            row.createCell(3).setCellValue(cell(it.getOrigin()));
            row.createCell(4).setCellValue(cell(it.getMessage()));
            row.createCell(5).setCellValue(it.getWarningCount());
            row.createCell(6).setCellValue(it.getElapsedMs());
            row.createCell(7).setCellValue(cell(it.getDetail()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<FormatWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        header(sh.createRow(r++), WARNING_HEADER);

        for (FormatWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode() == null ? "" : w.getCode().name());
            row.createCell(1).setCellValue(cell(w.getSourceId()));
            row.createCell(2).setCellValue(cell(w.getMessage()));
            row.createCell(3).setCellValue(cell(w.getDetail()));
        }
    }

    private static void header(Row row, String[] names) {
        for (int i = 0; i < names.length; i++) {
            row.createCell(i).setCellValue(names[i]);
        }
    }

    private static String cell(String s) {
        if (s == null) return "";
        return s.length() > MAX_CELL_CHARS ? s.substring(0, MAX_CELL_CHARS) : s;
    }
}
