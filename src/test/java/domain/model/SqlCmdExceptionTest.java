package domain.model;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class SqlCmdExceptionTest {

    @Test
    void defaultConstructor_hasGeneralCodeAndDefaultMessage() {
        SqlCmdException e = new SqlCmdException();

        assertEquals(SqlCmdErrorCode.GENERAL, e.getCode());
        assertEquals(SqlCmdException.DEFAULT_MESSAGE, e.getMessage());
        assertEquals("", e.getDetail());
        assertNull(e.getCause());
    }

    @Test
    void messageAndCause_areKept() {
        IOException cause = new IOException("io");
        SqlCmdException e = new SqlCmdException("custom", cause);

        assertEquals("custom", e.getMessage());
        assertSame(cause, e.getCause());
        assertEquals(SqlCmdErrorCode.GENERAL, e.getCode());
    }

    @Test
    void forVariableNotDefined() {
        SqlCmdException e = SqlCmdException.forVariableNotDefined("Env");

        assertEquals(SqlCmdErrorCode.UNDEFINED_VARIABLE, e.getCode());
        assertEquals("Variable Env is not defined.", e.getMessage());
        assertEquals("Env", e.getDetail());
    }

    @Test
    void forDirectiveSyntax_stripsLine() {
        SqlCmdException e = SqlCmdException.forDirectiveSyntax("  :setvar\r\n");

        assertEquals(SqlCmdErrorCode.DIRECTIVE_SYNTAX, e.getCode());
        assertEquals("Incorrect syntax in directive: :setvar", e.getMessage());
        assertEquals(":setvar", e.getDetail());
    }

    @Test
    void forIncludeFailure_appendsCauseMessage() {
        SqlCmdException withCause = SqlCmdException.forIncludeFailure("a.sql", new IOException("denied"));
        assertEquals("Failed to include file: a.sql (denied)", withCause.getMessage());
        assertEquals("a.sql", withCause.getDetail());
        assertEquals(SqlCmdErrorCode.INCLUDE_FAILURE, withCause.getCode());

        SqlCmdException bare = SqlCmdException.forIncludeFailure("b.sql", new IOException(" "));
        assertEquals("Failed to include file: b.sql", bare.getMessage());

        assertNull(SqlCmdException.forIncludeFailure("c.sql", null).getCause());
    }

    @Test
    void nullCode_fallsBackToGeneral() {
        SqlCmdException e = new SqlCmdException(null, "m", null, null);
        assertEquals(SqlCmdErrorCode.GENERAL, e.getCode());
        assertEquals("", e.getDetail());
    }
}
