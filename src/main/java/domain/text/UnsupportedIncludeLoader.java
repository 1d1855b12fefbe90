package domain.text;

import java.io.IOException;
import java.nio.charset.Charset;

/** Loader used when no include source is configured. */
final class UnsupportedIncludeLoader implements IncludeLoader {

    static final UnsupportedIncludeLoader INSTANCE = new UnsupportedIncludeLoader();

    private UnsupportedIncludeLoader() {
    }

    @Override
    public String load(String path, Charset encoding) throws IOException {
        throw new IOException("no include loader configured");
    }
}
