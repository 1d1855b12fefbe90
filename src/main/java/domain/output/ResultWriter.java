package domain.output;

import domain.model.BatchResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Stores the preprocessing report. */
public interface ResultWriter {

    void write(Path resultXlsx, List<BatchResult> results, Map<String, String> variables);
}
