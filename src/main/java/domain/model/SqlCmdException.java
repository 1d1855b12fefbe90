package domain.model;

/**
 * Represents an error condition encountered during SQLCMD preprocessing.
 *
 * <p>The {@link #getDetail() detail} holds the offending item: the variable name for
 * {@link SqlCmdErrorCode#UNDEFINED_VARIABLE}, the directive line for
 * {@link SqlCmdErrorCode#DIRECTIVE_SYNTAX}, the path for {@link SqlCmdErrorCode#INCLUDE_FAILURE}.</p>
 */
public class SqlCmdException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "An error occurred during SQLCMD preprocessing.";

    private static final String VARIABLE_NOT_DEFINED_MESSAGE = "Variable %s is not defined.";
    private static final String DIRECTIVE_SYNTAX_MESSAGE = "Incorrect syntax in directive: %s";
    private static final String INCLUDE_FAILURE_MESSAGE = "Failed to include file: %s";

    private final SqlCmdErrorCode code;
    private final String detail;

    public SqlCmdException() {
        this(SqlCmdErrorCode.GENERAL, DEFAULT_MESSAGE, "", null);
    }

    public SqlCmdException(String message) {
        this(SqlCmdErrorCode.GENERAL, message, "", null);
    }

    public SqlCmdException(String message, Throwable cause) {
        this(SqlCmdErrorCode.GENERAL, message, "", cause);
    }

    public SqlCmdException(SqlCmdErrorCode code, String message, String detail, Throwable cause) {
        super(message, cause);
        this.code = code == null ? SqlCmdErrorCode.GENERAL : code;
        this.detail = detail == null ? "" : detail;
    }

    public static SqlCmdException forVariableNotDefined(String name) {
        return new SqlCmdException(SqlCmdErrorCode.UNDEFINED_VARIABLE,
                String.format(VARIABLE_NOT_DEFINED_MESSAGE, name), name, null);
    }

    public static SqlCmdException forDirectiveSyntax(String directive) {
        String line = directive == null ? "" : directive.strip();
        return new SqlCmdException(SqlCmdErrorCode.DIRECTIVE_SYNTAX,
                String.format(DIRECTIVE_SYNTAX_MESSAGE, line), line, null);
    }

    public static SqlCmdException forIncludeFailure(String path, Throwable cause) {
        String message = String.format(INCLUDE_FAILURE_MESSAGE, path);
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            message = message + " (" + cause.getMessage() + ")";
        }
        return new SqlCmdException(SqlCmdErrorCode.INCLUDE_FAILURE, message, path, cause);
    }

    public SqlCmdErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }
}
