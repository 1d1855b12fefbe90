package domain.output;

import java.nio.file.Path;

/** Stores produced batches. */
public interface BatchOutputWriter {

    /**
     * @param batchIndex 1-based position of the batch in its script
     * @return where the batch was written, or {@code null} when nothing was written
     */
    Path write(Path outDir, String scriptFileName, int batchIndex, String batch);
}
