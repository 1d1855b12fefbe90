package cli;

import app.SqlCmdCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>The logic lives in {@link SqlCmdCliApp} to keep this class small and to enable testing.</p>
 */
public class SqlCmdCli {

    public static void main(String[] args) {
        int failed = SqlCmdCliApp.run(args);
        if (failed > 0) System.exit(1);
    }
}
