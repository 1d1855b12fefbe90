package infra.vars;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads SQLCMD variables from a two-column CSV (name,value).
 *
 * <p>UTF-8, BOM tolerated. The first row is treated as a header when its first cell is
 * {@code name} or {@code variable}. Rows with a blank name are skipped; values are kept
 * verbatim (not trimmed).</p>
 */
public final class VariableCsvLoader {

    static boolean isHeaderCell(String s) {
        String k = stripBom(s).trim().toLowerCase(Locale.ROOT);
        return k.equals("name") || k.equals("variable") || k.equals("var");
    }

    static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s == null ? "" : s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    public Map<String, String> load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException("variables csv not found: " + csvPath);

        try (InputStream is = Files.newInputStream(csvPath);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Map<String, String> out = new LinkedHashMap<>();
            boolean first = true;

            for (CSVRecord r : parser) {
                String name = r.size() > 0 ? stripBom(r.get(0)).trim() : "";
                if (first) {
                    first = false;
                    if (isHeaderCell(name)) continue;
                }
                if (name.isEmpty()) continue;

                String value = r.size() > 1 ? r.get(1) : "";
                out.put(name, value);
            }

            System.out.println("[VARS] csv loaded=" + out.size() + " (" + csvPath.getFileName() + ")");
            return out;

        } catch (IOException e) {
            throw new IllegalStateException("failed to load variables csv: " + csvPath, e);
        }
    }
}
