package infra.vars;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads SQLCMD variables from the first sheet of an XLSX workbook.
 *
 * <p>Column A = name, column B = value. Row 1 is skipped when A1 reads {@code name} or
 * {@code variable}. Numeric cells are rendered as displayed.</p>
 */
public final class VariableXlsxLoader {

    private final DataFormatter formatter = new DataFormatter();

    public Map<String, String> load(Path xlsxPath) {
        if (xlsxPath == null) throw new IllegalArgumentException("xlsxPath is null");
        if (!Files.exists(xlsxPath)) throw new IllegalArgumentException("variables xlsx not found: " + xlsxPath);

        try (InputStream is = Files.newInputStream(xlsxPath);
             Workbook wb = new XSSFWorkbook(is)) {

            Map<String, String> out = new LinkedHashMap<>();
            Sheet sheet = wb.getSheetAt(0);
            boolean first = true;

            for (Row row : sheet) {
                String name = get(row, 0).trim();
                if (first) {
                    first = false;
                    if (VariableCsvLoader.isHeaderCell(name)) continue;
                }
                if (name.isEmpty()) continue;

                out.put(name, get(row, 1));
            }

            System.out.println("[VARS] xlsx loaded=" + out.size() + " (" + xlsxPath.getFileName() + ")");
            return out;

        } catch (Exception e) {
            throw new IllegalStateException("failed to load variables xlsx: " + xlsxPath, e);
        }
    }

    private String get(Row row, int idx) {
        Cell cell = row.getCell(idx);
        if (cell == null) return "";
        return formatter.formatCellValue(cell);
    }
}
