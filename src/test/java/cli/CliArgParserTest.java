package cli;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parseArgs_supportsSpaceAndEqualsForms() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--in", "scripts", "--out=out dir", "--var=a=1,b=", "--failFast", "--noOut", "stray", "--encoding", "latin1"
        });

        assertEquals("scripts", m.get("in"));
        assertEquals("out dir", m.get("out"));
        assertEquals("a=1,b=", m.get("var"));
        assertEquals("", m.get("failFast"));
        assertEquals("stray", m.get("noOut"));
        assertEquals("latin1", m.get("encoding"));
    }

    @Test
    void parseArgs_nullIsEmpty() {
        assertTrue(CliArgParser.parseArgs(null).isEmpty());
    }

    @Test
    void flag_presenceStyle() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--a", "--b=false", "--c=yes"});

        assertTrue(CliArgParser.flag(m, "a"));
        assertFalse(CliArgParser.flag(m, "b"));
        assertTrue(CliArgParser.flag(m, "c"));
        assertFalse(CliArgParser.flag(m, "d"));
    }

    @Test
    void parseInt_fallsBackOnGarbage() {
        assertEquals(8, CliArgParser.parseInt(" 8 ", 64));
        assertEquals(64, CliArgParser.parseInt("eight", 64));
        assertEquals(64, CliArgParser.parseInt(null, 64));
    }

    @Test
    void parseCharset() {
        assertEquals(StandardCharsets.UTF_8, CliArgParser.parseCharset(null, StandardCharsets.UTF_8));
        assertEquals(StandardCharsets.ISO_8859_1, CliArgParser.parseCharset("ISO-8859-1", StandardCharsets.UTF_8));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseCharset("no-such-charset", StandardCharsets.UTF_8));
    }

    @Test
    void parseVariablePairs_keepsOrderAndEmptyValues() {
        Map<String, String> vars = CliArgParser.parseVariablePairs("Env=prod, Db=a=b ,Empty=");

        assertEquals(List.of("Env", "Db", "Empty"), List.copyOf(vars.keySet()));
        assertEquals("prod", vars.get("Env"));
        assertEquals("a=b ", vars.get("Db"));
        assertEquals("", vars.get("Empty"));
        assertTrue(CliArgParser.parseVariablePairs(" ").isEmpty());
    }

    @Test
    void parseVariablePairs_valueMayContainComma() {
        Map<String, String> vars = CliArgParser.parseVariablePairs("List=a,b,c,Env=prod,Csv=x, y");

        assertEquals(List.of("List", "Env", "Csv"), List.copyOf(vars.keySet()));
        assertEquals("a,b,c", vars.get("List"));
        assertEquals("prod", vars.get("Env"));
        assertEquals("x, y", vars.get("Csv"));
    }

    @Test
    void parseCharset_illegalName_isWrapped() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CliArgParser.parseCharset("bad name!", StandardCharsets.UTF_8));
        assertEquals("unsupported encoding: bad name!", e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void parseVariablePairs_rejectsMalformedPairs() {
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseVariablePairs("novalue"));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseVariablePairs(" =x"));
    }
}
