package app;

import domain.output.BatchOutputWriter;
import domain.output.ResultWriter;
import domain.sqlcmd.SqlCmdPreprocessor;
import infra.output.BatchResultXlsxWriter;
import infra.output.FileBatchOutputWriter;
import infra.output.NullBatchOutputWriter;
import infra.output.NullResultWriter;
import infra.text.FileIncludeLoader;
import infra.vars.VariableSources;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Map;

/**
 * Object-assembly factory for {@link SqlCmdCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class SqlCmdComponentsFactory {

    SqlCmdPreprocessor createPreprocessor(Charset encoding, boolean setvarReplace, int maxIncludeDepth) {
        SqlCmdPreprocessor preprocessor = new SqlCmdPreprocessor();
        preprocessor.setIncludeEncoding(encoding);
        preprocessor.setEnableVariableReplacementInSetvar(setvarReplace);
        preprocessor.setMaxIncludeDepth(maxIncludeDepth);
        return preprocessor;
    }

    Map<String, String> loadVariables(Path varsFile) {
        return VariableSources.load(varsFile);
    }

    FileIncludeLoader createIncludeLoader(Path includeDir) {
        return new FileIncludeLoader(includeDir);
    }

    BatchOutputWriter createBatchOutputWriter(boolean enable) {
        if (!enable) return new NullBatchOutputWriter();
        return new FileBatchOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new BatchResultXlsxWriter();
    }
}
