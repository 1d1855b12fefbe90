package domain.sqlcmd;

/**
 * A matched element and its span {@code [start, end)} in the scanned text.
 *
 * <p>{@link #getValue()} is the variable name for {@link SqlCmdTokenKind#VARIABLE_REFERENCE}
 * and the raw argument text (line terminator excluded) for directives; empty otherwise.</p>
 */
final class SqlCmdToken {

    private final SqlCmdTokenKind kind;
    private final int start;
    private final int end;
    private final String value;

    SqlCmdToken(SqlCmdTokenKind kind, int start, int end, String value) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.value = value == null ? "" : value;
    }

    SqlCmdToken(SqlCmdTokenKind kind, int start, int end) {
        this(kind, start, end, "");
    }

    SqlCmdTokenKind getKind() {
        return kind;
    }

    int getStart() {
        return start;
    }

    int getEnd() {
        return end;
    }

    String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")" + (value.isEmpty() ? "" : " " + value);
    }
}
