package infra.output;

import domain.output.BatchOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullBatchOutputWriter implements BatchOutputWriter {
    @Override
    public Path write(Path outDir, String scriptFileName, int batchIndex, String batch) {
        return null;
    }
}
