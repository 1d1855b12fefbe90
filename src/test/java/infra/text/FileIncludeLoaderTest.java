package infra.text;

import domain.model.SqlCmdErrorCode;
import domain.model.SqlCmdException;
import domain.sqlcmd.SqlCmdPreprocessor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileIncludeLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void relativePath_resolvesAgainstBaseDir() throws Exception {
        Files.createDirectories(tmp.resolve("inc"));
        Files.writeString(tmp.resolve("inc/a.sql"), "SELECT 1;\r\n", StandardCharsets.UTF_8);

        FileIncludeLoader loader = new FileIncludeLoader(tmp);
        assertEquals("SELECT 1;\r\n", loader.load("inc/a.sql", StandardCharsets.UTF_8));
        assertEquals(tmp.resolve("inc/a.sql").toAbsolutePath().normalize(), loader.resolve(" inc/./a.sql "));
    }

    @Test
    void absolutePath_ignoresBaseDir() throws Exception {
        Path f = tmp.resolve("abs.sql");
        Files.writeString(f, "X", StandardCharsets.UTF_8);

        FileIncludeLoader loader = new FileIncludeLoader(tmp.resolve("elsewhere"));
        assertEquals("X", loader.load(f.toAbsolutePath().toString(), StandardCharsets.UTF_8));
    }

    @Test
    void leadingBom_isDropped() throws Exception {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'G', 'O'};
        Files.write(tmp.resolve("bom.sql"), bytes);

        assertEquals("GO", new FileIncludeLoader(tmp).load("bom.sql", StandardCharsets.UTF_8));
    }

    @Test
    void encoding_isHonored() throws Exception {
        Files.write(tmp.resolve("latin.sql"), "SELECT 'é';".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals("SELECT 'é';", new FileIncludeLoader(tmp).load("latin.sql", StandardCharsets.ISO_8859_1));
    }

    @Test
    void invalidBytes_areRejected() throws Exception {
        Files.write(tmp.resolve("bad.sql"), new byte[]{'A', (byte) 0xC3, (byte) 0x28});

        IOException e = assertThrows(IOException.class,
                () -> new FileIncludeLoader(tmp).load("bad.sql", StandardCharsets.UTF_8));
        assertTrue(e.getMessage().contains("cannot decode"), e.getMessage());
    }

    @Test
    void missingFile_isNoSuchFile() {
        assertThrows(NoSuchFileException.class,
                () -> new FileIncludeLoader(tmp).load("missing.sql", StandardCharsets.UTF_8));
    }

    @Test
    void directory_isNotAFile() throws Exception {
        Files.createDirectories(tmp.resolve("dir"));

        assertThrows(NoSuchFileException.class,
                () -> new FileIncludeLoader(tmp).load("dir", StandardCharsets.UTF_8));
    }

    @Test
    void blankPath_isRejected() {
        assertThrows(IOException.class, () -> new FileIncludeLoader(tmp).load("  ", StandardCharsets.UTF_8));
    }

    @Test
    void rejectedPath_failsAsIOException() {
        IOException e = assertThrows(IOException.class,
                () -> new FileIncludeLoader(tmp).load("a\u0000b.sql", StandardCharsets.UTF_8));
        assertInstanceOf(InvalidPathException.class, e.getCause());
    }

    @Test
    void rejectedPath_isIncludeFailure_inPreprocessor() {
        SqlCmdPreprocessor p = new SqlCmdPreprocessor();
        p.setIncludeLoader(new FileIncludeLoader(tmp));

        SqlCmdException e = assertThrows(SqlCmdException.class, () -> p.processAll(":r \"a\u0000b.sql\"\n"));
        assertEquals(SqlCmdErrorCode.INCLUDE_FAILURE, e.getCode());
        assertInstanceOf(InvalidPathException.class, e.getCause().getCause());
    }

    @Test
    void nullBaseDir_usesWorkingDirectory() {
        Path expected = Path.of(System.getProperty("user.dir", ".")).toAbsolutePath().normalize();
        assertEquals(expected, new FileIncludeLoader(null).getBaseDir());
    }
}
