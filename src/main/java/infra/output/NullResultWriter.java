package infra.output;

import domain.model.BatchResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<BatchResult> results, Map<String, String> variables) {
        // intentionally no-op
    }
}
