package domain.model;

/**
 * Error codes for SQLCMD preprocessing failures.
 *
 * <p>Every code is fatal to the current {@code process} call.</p>
 */
public enum SqlCmdErrorCode {

    /**
     * A {@code $(name)} reference names a variable that is not defined.
     */
    UNDEFINED_VARIABLE,

    /**
     * {@code :r} without a path, or {@code :setvar} without a name or value.
     */
    DIRECTIVE_SYNTAX,

    /**
     * The text of an {@code :r} target could not be loaded or decoded.
     */
    INCLUDE_FAILURE,

    /**
     * Anything else.
     */
    GENERAL
}
