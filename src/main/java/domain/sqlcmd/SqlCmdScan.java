package domain.sqlcmd;

/**
 * Finds the next significant element of a SQLCMD script.
 *
 * <p>The scan is leftmost-first: the earliest position holding any element wins. When several
 * elements could start at the same position the order is fixed: quoted string/identifier,
 * comment, variable reference, batch separator, directive. Unterminated strings, identifiers
 * and comments run to the end of the text.</p>
 */
final class SqlCmdScan {

    private static final String SETVAR = "setvar";
    private static final String INCLUDE = "r";

    final String s;

    SqlCmdScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    /**
     * @return the first element at or after {@code from}, or {@code null} when there is none
     */
    SqlCmdToken find(int from) {
        for (int p = Math.max(0, from); p < s.length(); p++) {
            SqlCmdToken t = matchAt(p);
            if (t != null) return t;
        }
        return null;
    }

    /**
     * Finds a closed {@code $(name)} reference inside {@code [from, end)}. Quotes and comments are
     * not interpreted, so this is meant for the inside of an already matched quoted span.
     */
    SqlCmdToken findVariable(int from, int end) {
        int limit = Math.min(end, s.length());
        for (int p = Math.max(0, from); p + 1 < limit; p++) {
            if (s.charAt(p) != '$' || s.charAt(p + 1) != '(') continue;

            int q = p + 2;
            while (q < limit && isWordChar(s.charAt(q))) q++;
            if (q > p + 2 && q < limit && s.charAt(q) == ')') {
                return new SqlCmdToken(SqlCmdTokenKind.VARIABLE_REFERENCE, p, q + 1, s.substring(p + 2, q));
            }
        }
        return null;
    }

    private SqlCmdToken matchAt(int p) {
        char c = s.charAt(p);

        if (c == '\'') return readQuoted(p, '\'', SqlCmdTokenKind.QUOTED_STRING);
        if (c == '[') return readQuoted(p, ']', SqlCmdTokenKind.QUOTED_IDENTIFIER);

        if (c == '-' && peekIs(p + 1, '-')) return readLineComment(p);
        if (c == '/' && peekIs(p + 1, '*')) return readBlockComment(p);

        if (c == '$' && peekIs(p + 1, '(')) {
            SqlCmdToken t = readVariable(p);
            if (t != null) return t;
        }

        if (isLineStart(p)) {
            SqlCmdToken t = readBatchSeparator(p);
            if (t != null) return t;
            return readDirective(p);
        }
        return null;
    }

    private boolean peekIs(int p, char c) {
        return p < s.length() && s.charAt(p) == c;
    }

    private boolean isLineStart(int p) {
        return p == 0 || s.charAt(p - 1) == '\n';
    }

    private int skipBlanks(int p) {
        while (p < s.length() && isBlank(s.charAt(p))) p++;
        return p;
    }

    /**
     * @return the position just past the line terminator at {@code p}, {@code s.length()} at end of
     * text, or -1 when {@code p} is not at a line end
     */
    private int lineEndAt(int p) {
        if (p == s.length()) return p;
        if (s.charAt(p) == '\n') return p + 1;
        if (s.charAt(p) == '\r' && peekIs(p + 1, '\n')) return p + 2;
        return -1;
    }

    // '' inside a string and ]] inside an identifier are escapes
    private SqlCmdToken readQuoted(int start, char close, SqlCmdTokenKind kind) {
        int p = start + 1;
        while (p < s.length()) {
            char c = s.charAt(p++);
            if (c == close) {
                if (peekIs(p, close)) {
                    p++;
                    continue;
                }
                return new SqlCmdToken(kind, start, p);
            }
        }
        return new SqlCmdToken(kind, start, s.length());
    }

    private SqlCmdToken readLineComment(int start) {
        int nl = s.indexOf('\n', start + 2);
        return new SqlCmdToken(SqlCmdTokenKind.LINE_COMMENT, start, nl < 0 ? s.length() : nl + 1);
    }

    private SqlCmdToken readBlockComment(int start) {
        int close = s.indexOf("*/", start + 2);
        return new SqlCmdToken(SqlCmdTokenKind.BLOCK_COMMENT, start, close < 0 ? s.length() : close + 2);
    }

    private SqlCmdToken readVariable(int start) {
        int q = start + 2;
        while (q < s.length() && isWordChar(s.charAt(q))) q++;
        if (q == start + 2) return null;

        String name = s.substring(start + 2, q);
        if (q == s.length()) {
            return new SqlCmdToken(SqlCmdTokenKind.VARIABLE_REFERENCE, start, q, name);
        }
        if (s.charAt(q) == ')') {
            return new SqlCmdToken(SqlCmdTokenKind.VARIABLE_REFERENCE, start, q + 1, name);
        }
        return null;
    }

    private SqlCmdToken readBatchSeparator(int start) {
        int p = skipBlanks(start);
        if (p + 2 > s.length()) return null;
        if (Character.toUpperCase(s.charAt(p)) != 'G' || Character.toUpperCase(s.charAt(p + 1)) != 'O') return null;

        int end = lineEndAt(skipBlanks(p + 2));
        if (end < 0) return null;
        return new SqlCmdToken(SqlCmdTokenKind.BATCH_SEPARATOR, start, end);
    }

    private SqlCmdToken readDirective(int start) {
        int p = skipBlanks(start);
        if (!peekIs(p, ':')) return null;
        p++;

        SqlCmdTokenKind kind;
        int keywordEnd;
        if (s.regionMatches(true, p, SETVAR, 0, SETVAR.length())) {
            kind = SqlCmdTokenKind.SETVAR_DIRECTIVE;
            keywordEnd = p + SETVAR.length();
        } else if (s.regionMatches(true, p, INCLUDE, 0, INCLUDE.length())) {
            kind = SqlCmdTokenKind.INCLUDE_DIRECTIVE;
            keywordEnd = p + INCLUDE.length();
        } else {
            return null;
        }

        // ":rollback" or ":setvars" are not directives
        if (keywordEnd < s.length()) {
            char next = s.charAt(keywordEnd);
            if (!isBlank(next) && next != '\r' && next != '\n') return null;
        }

        int nl = s.indexOf('\n', keywordEnd);
        int end = nl < 0 ? s.length() : nl + 1;
        int argsEnd = nl < 0 ? s.length() : nl;
        if (argsEnd > keywordEnd && s.charAt(argsEnd - 1) == '\r') argsEnd--;

        return new SqlCmdToken(kind, start, end, s.substring(keywordEnd, argsEnd));
    }
}
