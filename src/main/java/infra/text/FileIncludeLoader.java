package infra.text;

import domain.text.IncludeLoader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * {@link IncludeLoader} reading {@code :r} targets from the file system.
 * <p>
 * - relative paths are resolved against {@code baseDir}
 * - invalid byte sequences are rejected, not replaced
 * - a leading BOM is dropped
 * - a path the platform rejects fails like an unreadable file
 */
public final class FileIncludeLoader implements IncludeLoader {

    private final Path baseDir;

    public FileIncludeLoader(Path baseDir) {
        this.baseDir = (baseDir == null)
                ? Path.of(System.getProperty("user.dir", ".")).toAbsolutePath().normalize()
                : baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * @throws IOException when the platform rejects {@code path} as a file name
     */
    Path resolve(String path) throws IOException {
        Path p;
        try {
            p = Path.of(path.trim());
        } catch (InvalidPathException e) {
            throw new IOException("invalid include path: " + e.getMessage(), e);
        }
        if (!p.isAbsolute()) p = baseDir.resolve(p);
        return p.toAbsolutePath().normalize();
    }

    @Override
    public String load(String path, Charset encoding) throws IOException {
        if (path == null || path.isBlank()) throw new IOException("include path is blank");

        Path file = resolve(path);
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());

        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = encoding.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("cannot decode " + file + " as " + encoding.name(), e);
        }
        return stripBom(text);
    }

    private static String stripBom(String s) {
        if (s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
