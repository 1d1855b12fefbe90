package infra.vars;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableXlsxLoaderTest {

    @TempDir
    Path tmp;

    private static Path writeWorkbook(Path file) throws Exception {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sh = wb.createSheet("vars");
            Row header = sh.createRow(0);
            header.createCell(0).setCellValue("Variable");
            header.createCell(1).setCellValue("Value");

            Row r1 = sh.createRow(1);
            r1.createCell(0).setCellValue("DbName");
            r1.createCell(1).setCellValue("Sales");

            Row r2 = sh.createRow(2);
            r2.createCell(0).setCellValue("Retries");
            r2.createCell(1).setCellValue(3);

            Row r3 = sh.createRow(3);
            r3.createCell(1).setCellValue("no name");

            Row r4 = sh.createRow(4);
            r4.createCell(0).setCellValue("Blank");

            wb.createSheet("ignored").createRow(0).createCell(0).setCellValue("Other");

            try (OutputStream os = Files.newOutputStream(file)) {
                wb.write(os);
            }
        }
        return file;
    }

    @Test
    void load_readsFirstSheet() throws Exception {
        Path xlsx = writeWorkbook(tmp.resolve("vars.xlsx"));

        Map<String, String> vars = new VariableXlsxLoader().load(xlsx);

        assertEquals(3, vars.size());
        assertEquals("Sales", vars.get("DbName"));
        assertEquals("3", vars.get("Retries"));
        assertEquals("", vars.get("Blank"));
        assertFalse(vars.containsKey("Other"));
    }

    @Test
    void sources_dispatchByExtension() throws Exception {
        Path xlsx = writeWorkbook(tmp.resolve("VARS.XLSX"));
        Path csv = tmp.resolve("vars.txt");
        Files.writeString(csv, "DbName,Hr\n", StandardCharsets.UTF_8);

        assertEquals("Sales", VariableSources.load(xlsx).get("DbName"));
        assertEquals("Hr", VariableSources.load(csv).get("DbName"));
    }

    @Test
    void load_missingFile_throws() {
        assertThrows(IllegalArgumentException.class, () -> new VariableXlsxLoader().load(tmp.resolve("none.xlsx")));
        assertThrows(IllegalArgumentException.class, () -> VariableSources.load(null));
    }

    @Test
    void load_notAWorkbook_throws() throws Exception {
        Path bogus = tmp.resolve("bogus.xlsx");
        Files.writeString(bogus, "not a zip", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> new VariableXlsxLoader().load(bogus));
    }
}
