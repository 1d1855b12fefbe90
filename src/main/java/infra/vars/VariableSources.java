package infra.vars;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Picks the variable loader by file extension (.xlsx or anything else as CSV). */
public final class VariableSources {

    private VariableSources() {
    }

    public static Map<String, String> load(Path file) {
        if (file == null) throw new IllegalArgumentException("variables file is null");
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx")) {
            return new VariableXlsxLoader().load(file);
        }
        return new VariableCsvLoader().load(file);
    }
}
