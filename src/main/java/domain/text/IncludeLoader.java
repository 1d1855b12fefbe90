package domain.text;

import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Loads the text named by an {@code :r} directive.
 *
 * <p>The preprocessor only ever sees decoded text; where it comes from and how the bytes
 * are decoded is up to the implementation.</p>
 */
public interface IncludeLoader {

    static IncludeLoader unsupported() {
        return UnsupportedIncludeLoader.INSTANCE;
    }

    /**
     * @param path     the path exactly as written in the directive (quotes removed)
     * @param encoding the preprocessor's configured include encoding
     * @return the decoded text, never {@code null}
     * @throws IOException when the text cannot be read or decoded
     */
    String load(String path, Charset encoding) throws IOException;
}
