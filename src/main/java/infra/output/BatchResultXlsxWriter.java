package infra.output;

import domain.model.BatchResult;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>batches: one row per produced batch, plus one ERROR row per failed script</li>
 *   <li>variables: the variable table after the last script</li>
 * </ul>
 */
public final class BatchResultXlsxWriter implements ResultWriter {

    // cell text limit of the xlsx format
    private static final int MAX_CELL_LENGTH = 32_767;

    private static void writeBatchesSheet(Workbook wb, List<BatchResult> results) {
        Sheet sh = wb.createSheet("batches");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("status");
        header.createCell(1)
                .setCellValue("script");
        header.createCell(2)
                .setCellValue("batch");
        header.createCell(3)
                .setCellValue("length");
        header.createCell(4)
                .setCellValue("firstLine");
        header.createCell(5)
                .setCellValue("errorCode");
        header.createCell(6)
                .setCellValue("message");

        for (BatchResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getScript());
            row.createCell(2)
                    .setCellValue(it.getBatchIndex());
            row.createCell(3)
                    .setCellValue(it.getLength());
            row.createCell(4)
                    .setCellValue(clip(it.getFirstLine()));
            row.createCell(5)
                    .setCellValue(it.getErrorCode());
            row.createCell(6)
                    .setCellValue(clip(it.getMessage()));
        }
    }

    private static void writeVariablesSheet(Workbook wb, Map<String, String> variables) {
        Sheet sh = wb.createSheet("variables");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("name");
        header.createCell(1)
                .setCellValue("value");

        for (Map.Entry<String, String> e : variables.entrySet()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(e.getKey());
            row.createCell(1)
                    .setCellValue(clip(e.getValue()));
        }
    }

    private static String clip(String s) {
        if (s == null) return "";
        return s.length() <= MAX_CELL_LENGTH ? s : s.substring(0, MAX_CELL_LENGTH);
    }

    @Override
    public void write(Path resultXlsx, List<BatchResult> results, Map<String, String> variables) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (variables == null) throw new IllegalArgumentException("variables is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeBatchesSheet(wb, results);
            writeVariablesSheet(wb, variables);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
