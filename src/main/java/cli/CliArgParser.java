package cli;

import java.nio.charset.Charset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    // ',' followed by the next "name="
    private static final Pattern PAIR_SEPARATOR = Pattern.compile(",(?=\\s*[A-Za-z_][A-Za-z0-9_]*\\s*=)");

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Charset by name; blank means {@code def}.
     *
     * @throws IllegalArgumentException for an unknown or unsupported name
     */
    public static Charset parseCharset(String raw, Charset def) {
        if (raw == null || raw.isBlank()) return def;
        try {
            return Charset.forName(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported encoding: " + raw.trim(), e);
        }
    }

    /**
     * Inline variables: {@code name=value[,name=value...]}. The value may be empty; the first
     * '=' separates name and value. A ',' only starts a new pair when {@code name=} follows it,
     * so {@code list=a,b} is one variable with the value {@code a,b}.
     *
     * @throws IllegalArgumentException for a pair without '=' or with a blank name
     */
    public static Map<String, String> parseVariablePairs(String raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) return out;

        for (String pair : PAIR_SEPARATOR.split(raw)) {
            if (pair.isBlank()) continue;
            int eq = pair.indexOf('=');
            if (eq < 0) throw new IllegalArgumentException("variable must be name=value: " + pair.trim());

            String name = pair.substring(0, eq).trim();
            if (name.isEmpty()) throw new IllegalArgumentException("variable name is blank: " + pair.trim());
            out.put(name, pair.substring(eq + 1));
        }
        return out;
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
