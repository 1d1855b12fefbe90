package infra.output;

import domain.output.BatchFileNamePolicy;
import domain.output.BatchOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link BatchOutputWriter} that stores each batch in its own file.
 * <p>
 * Output layout:
 * &lt;outDir&gt;/&lt;scriptName&gt;/&lt;scriptName&gt;_&lt;nnnn&gt;.sql (UTF-8, no BOM)
 */
public final class FileBatchOutputWriter implements BatchOutputWriter {

    @Override
    public Path write(Path outDir, String scriptFileName, int batchIndex, String batch) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");
        if (batchIndex < 1) throw new IllegalArgumentException("batchIndex must be >= 1: " + batchIndex);

        Path targetDir = outDir.resolve(BatchFileNamePolicy.scriptName(scriptFileName));
        Path target = targetDir.resolve(BatchFileNamePolicy.build(scriptFileName, batchIndex));

        try {
            Files.createDirectories(targetDir);
            Files.writeString(target, batch == null ? "" : batch, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write batch: " + target, e);
        }
        return target;
    }
}
