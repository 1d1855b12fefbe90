package domain.sqlcmd;

/** Lexically significant elements recognized by {@link SqlCmdScan}. */
enum SqlCmdTokenKind {
    LINE_COMMENT,
    BLOCK_COMMENT,
    QUOTED_STRING,
    QUOTED_IDENTIFIER,
    VARIABLE_REFERENCE,
    BATCH_SEPARATOR,
    INCLUDE_DIRECTIVE,
    SETVAR_DIRECTIVE
}
