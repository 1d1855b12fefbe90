package domain.output;

import java.util.Locale;

/**
 * File naming policy for written batches.
 * <p>
 * &lt;outDir&gt;/&lt;scriptName&gt;/&lt;scriptName&gt;_&lt;nnnn&gt;.sql
 * e.g. deploy.sql, batch 3 -&gt; deploy/deploy_0003.sql
 */
public final class BatchFileNamePolicy {

    private BatchFileNamePolicy() {
    }

    /**
     * Script base name without extension, reduced to filename-safe characters.
     */
    public static String scriptName(String scriptFileName) {
        String s = scriptFileName == null ? "" : scriptFileName.trim();
        int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
        if (slash >= 0) s = s.substring(slash + 1);

        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);

        return limit(safePart(s, "script"), 120);
    }

    /**
     * @param batchIndex 1-based
     */
    public static String build(String scriptFileName, int batchIndex) {
        return scriptName(scriptFileName) + "_" + String.format(Locale.ROOT, "%04d", batchIndex) + ".sql";
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
