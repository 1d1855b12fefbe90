package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import domain.model.BatchResult;
import domain.model.SqlCmdException;
import domain.output.BatchOutputWriter;
import domain.output.ResultWriter;
import domain.sqlcmd.SqlCmdPreprocessor;
import infra.text.FileIncludeLoader;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link cli.SqlCmdCli}). */
public final class SqlCmdCliApp {

    private SqlCmdCliApp() {}

    /**
     * @return number of scripts that failed
     */
    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        String inRaw = CliPathResolver.trimToNull(argv.get("in"));
        if (inRaw == null) throw new IllegalArgumentException("--in is required (script file or directory)");

        Path input = CliPathResolver.resolvePath(baseDir, inRaw);
        Path outDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", "output/batches"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", "output/sqlcmd-result.xlsx"));
        Path varsFile = CliPathResolver.resolvePath(baseDir, argv.get("vars"));
        Path includeDir = CliPathResolver.resolvePath(baseDir, argv.get("includeDir"));

        Charset encoding = CliArgParser.parseCharset(argv.get("encoding"), StandardCharsets.UTF_8);
        boolean setvarReplace = CliArgParser.flag(argv, "setvarReplace");
        int maxIncludeDepth = CliArgParser.parseInt(argv.get("maxIncludeDepth"), SqlCmdPreprocessor.DEFAULT_MAX_INCLUDE_DEPTH);
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean noOut = CliArgParser.flag(argv, "noOut");
        boolean noResult = CliArgParser.flag(argv, "noResult");

        System.out.println("==================================================");
        System.out.println("[START] SQLCMD preprocessing");
        System.out.println("[CONF] baseDir         = " + baseDir);
        System.out.println("[CONF] in              = " + input);
        System.out.println("[CONF] out             = " + outDir);
        System.out.println("[CONF] result          = " + resultXlsx);
        System.out.println("[CONF] vars            = " + (varsFile == null ? "" : varsFile));
        System.out.println("[CONF] includeDir      = " + (includeDir == null ? "(script dir)" : includeDir));
        System.out.println("[CONF] encoding        = " + encoding.name());
        System.out.println("[CONF] setvarReplace   = " + setvarReplace);
        System.out.println("[CONF] maxIncludeDepth = " + maxIncludeDepth);
        System.out.println("[CONF] failFast        = " + failFast);
        System.out.println("[CONF] enableOut       = " + (!noOut) + " (use --noOut)");
        System.out.println("[CONF] enableResult    = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        List<Path> scripts = CliPathResolver.listScripts(input);

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        SqlCmdComponentsFactory factory = new SqlCmdComponentsFactory();
        SqlCmdPreprocessor preprocessor = factory.createPreprocessor(encoding, setvarReplace, maxIncludeDepth);

        if (varsFile != null) {
            CliPathResolver.validateFileExists(varsFile, "variables file (--vars)");
            long tVars0 = System.nanoTime();
            preprocessor.getVariables().putAll(factory.loadVariables(varsFile));
            System.out.println("[STEP1] variables file loaded. elapsed=" + ms(tVars0) + "ms");
        }
        Map<String, String> inline = CliArgParser.parseVariablePairs(argv.get("var"));
        preprocessor.getVariables().putAll(inline);
        System.out.println("[STEP1] variables=" + preprocessor.getVariables().size() + " (inline=" + inline.size() + ")");

        if (!noOut) CliPathResolver.mkdirs(outDir);

        BatchOutputWriter batchWriter = factory.createBatchOutputWriter(!noOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        long tLoop0 = System.nanoTime();
        System.out.println("[STEP2] preprocessing start. scripts=" + scripts.size());

        List<BatchResult> results = new ArrayList<>(Math.max(16, scripts.size() * 4));
        int success = 0;
        int failed = 0;
        int batches = 0;

        for (Path script : scripts) {
            String name = script.getFileName().toString();
            Path scriptDir = script.toAbsolutePath().getParent();
            FileIncludeLoader loader = factory.createIncludeLoader(includeDir != null ? includeDir : scriptDir);
            preprocessor.setIncludeLoader(loader);

            int index = 0;
            try {
                String sql = loader.load(script.toAbsolutePath().toString(), encoding);

                for (String batch : preprocessor.process(sql)) {
                    index++;
                    batchWriter.write(outDir, name, index, batch);
                    results.add(BatchResult.success(name, index, batch));
                }
                batches += index;
                success++;
                System.out.println("[SCRIPT] " + name + " batches=" + index);

            } catch (SqlCmdException e) {
                failed++;
                batches += index;
                results.add(BatchResult.error(name, index + 1, e.getCode().name(), e.getMessage()));
                System.out.println("[ERROR] " + name + " batch=" + (index + 1) + " " + e.getCode() + ": " + e.getMessage());

            } catch (IOException e) {
                failed++;
                results.add(BatchResult.error(name, 0, "READ_FAILURE", e.getMessage()));
                System.out.println("[ERROR] " + name + " read failed: " + e.getMessage());
            }

            if (failFast && failed > 0) {
                System.out.println("[FAILFAST] stop on first error.");
                break;
            }
        }

        System.out.println("[STEP2] preprocessing done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] success=" + success + ", failed=" + failed + ", batches=" + batches);

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP3] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, preprocessor.getVariables());
            System.out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP3] result xlsx skipped (--noResult). rows=" + results.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return failed;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
