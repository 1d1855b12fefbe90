package domain.sqlcmd;

import domain.model.SqlCmdException;
import domain.text.IncludeLoader;

import java.io.IOException;

/**
 * Executes {@code :setvar} and {@code :r} directives for a {@link BatchScanner}.
 *
 * <pre>
 * :setvar &lt;name&gt; &lt;value&gt;
 * :r &lt;path&gt;
 * </pre>
 * A value or path is either a run of non-blank characters or a double-quoted text in which
 * {@code ""} stands for one quote.
 */
final class DirectiveExecutor {

    private final SqlCmdPreprocessor owner;

    DirectiveExecutor(SqlCmdPreprocessor owner) {
        this.owner = owner;
    }

    void setvar(String line, String args) {
        ArgCursor c = new ArgCursor(args);
        c.skipBlanks();

        String name = c.readName();
        if (name == null || c.skipBlanks() == 0) throw SqlCmdException.forDirectiveSyntax(line);

        String value = c.readArgument();
        if (value == null) throw SqlCmdException.forDirectiveSyntax(line);

        c.skipBlanks();
        if (c.hasNext()) throw SqlCmdException.forDirectiveSyntax(line);

        if (owner.isEnableVariableReplacementInSetvar()) {
            value = expand(value);
        }
        owner.getVariables().put(name, value);
    }

    /**
     * @param depth number of includes already active
     * @return the text to splice in place of the directive line
     */
    String include(String line, String args, int depth) {
        ArgCursor c = new ArgCursor(args);
        c.skipBlanks();

        String path = c.readArgument();
        if (path == null || path.isEmpty()) throw SqlCmdException.forDirectiveSyntax(line);

        c.skipBlanks();
        if (c.hasNext()) throw SqlCmdException.forDirectiveSyntax(line);

        path = expand(path);

        if (depth >= owner.getMaxIncludeDepth()) {
            throw SqlCmdException.forIncludeFailure(path,
                    new IllegalStateException("include depth exceeds " + owner.getMaxIncludeDepth()));
        }

        IncludeLoader loader = owner.getIncludeLoader();
        String text;
        try {
            text = loader.load(path, owner.getIncludeEncoding());
        } catch (IOException e) {
            throw SqlCmdException.forIncludeFailure(path, e);
        }
        if (text == null) throw SqlCmdException.forIncludeFailure(path, null);
        return text;
    }

    /**
     * Replaces every closed {@code $(name)} in {@code text}. Uses its own builder: the scratch
     * buffer is holding the batch under construction.
     */
    String expand(String text) {
        SqlCmdScan scan = new SqlCmdScan(text);
        SqlCmdToken ref = scan.findVariable(0, text.length());
        if (ref == null) return text;

        StringBuilder sb = new StringBuilder(text.length() + 16);
        int p = 0;
        while (ref != null) {
            sb.append(text, p, ref.getStart());
            sb.append(owner.valueOf(ref.getValue()));
            p = ref.getEnd();
            ref = scan.findVariable(p, text.length());
        }
        sb.append(text, p, text.length());
        return sb.toString();
    }

    private static final class ArgCursor {
        final String s;
        int pos = 0;

        ArgCursor(String s) {
            this.s = (s == null) ? "" : s;
        }

        boolean hasNext() {
            return pos < s.length();
        }

        int skipBlanks() {
            int start = pos;
            while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
            return pos - start;
        }

        // identifier; must not start with a digit
        String readName() {
            if (pos >= s.length()) return null;
            char first = s.charAt(pos);
            if (Character.isDigit(first) || !SqlCmdScan.isWordChar(first)) return null;

            int start = pos;
            while (pos < s.length() && SqlCmdScan.isWordChar(s.charAt(pos))) pos++;
            return s.substring(start, pos);
        }

        String readArgument() {
            if (pos >= s.length()) return null;
            if (s.charAt(pos) == '"') return readQuoted();

            int start = pos;
            while (pos < s.length() && !Character.isWhitespace(s.charAt(pos))) pos++;
            return s.substring(start, pos);
        }

        // unterminated quote runs to the end of the line
        private String readQuoted() {
            StringBuilder sb = new StringBuilder();
            pos++; // "
            while (pos < s.length()) {
                char c = s.charAt(pos++);
                if (c == '"') {
                    if (pos < s.length() && s.charAt(pos) == '"') {
                        sb.append('"');
                        pos++;
                        continue;
                    }
                    break;
                }
                sb.append(c);
            }
            return sb.toString();
        }
    }
}
