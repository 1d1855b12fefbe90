package domain.sqlcmd;

import domain.model.SqlCmdException;
import domain.text.IncludeLoader;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A SQL preprocessor supporting a subset of SQLCMD:
 * <ul>
 *   <li>{@code GO} batch splitting</li>
 *   <li>{@code $(name)} variable replacement</li>
 *   <li>{@code :r <path>} inclusion</li>
 *   <li>{@code :setvar <name> <value>} variable (re)definition</li>
 * </ul>
 *
 * <p>An instance owns one scratch buffer that is reused for every batch it builds, so it must
 * not be used from several threads at once.</p>
 */
public class SqlCmdPreprocessor {

    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 64;

    private final Map<String, String> variables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private boolean enableVariableReplacementInSetvar;
    private IncludeLoader includeLoader = IncludeLoader.unsupported();
    private Charset includeEncoding = StandardCharsets.UTF_8;
    private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;

    private StringBuilder builder;
    private boolean building;

    /**
     * Preprocessor variables. Names are compared case-insensitively.
     */
    public Map<String, String> getVariables() {
        return variables;
    }

    /**
     * Whether {@code $(name)} references are replaced inside {@code :setvar} values.
     * Default {@code false}, matching SQLCMD.
     */
    public boolean isEnableVariableReplacementInSetvar() {
        return enableVariableReplacementInSetvar;
    }

    public void setEnableVariableReplacementInSetvar(boolean enable) {
        this.enableVariableReplacementInSetvar = enable;
    }

    public IncludeLoader getIncludeLoader() {
        return includeLoader;
    }

    public void setIncludeLoader(IncludeLoader includeLoader) {
        this.includeLoader = Objects.requireNonNull(includeLoader, "includeLoader");
    }

    public Charset getIncludeEncoding() {
        return includeEncoding;
    }

    public void setIncludeEncoding(Charset includeEncoding) {
        this.includeEncoding = Objects.requireNonNull(includeEncoding, "includeEncoding");
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    public void setMaxIncludeDepth(int maxIncludeDepth) {
        if (maxIncludeDepth < 0) throw new IllegalArgumentException("maxIncludeDepth must be >= 0: " + maxIncludeDepth);
        this.maxIncludeDepth = maxIncludeDepth;
    }

    /**
     * Splits {@code sql} into batches, replacing variables and performing directives.
     *
     * <p>The null check happens here; scanning happens only while the returned sequence is
     * iterated, one batch per {@code next()}. Each iteration rescans from the start.</p>
     *
     * @return the batches of {@code sql}; empty when {@code sql} is empty
     * @throws NullPointerException if {@code sql} is null
     * @throws SqlCmdException      during iteration, on an undefined variable, a malformed
     *                              directive or a failed include
     */
    public Iterable<String> process(String sql) {
        Objects.requireNonNull(sql, "sql");
        return () -> new BatchScanner(this, sql);
    }

    /** Eager form of {@link #process(String)}. */
    public List<String> processAll(String sql) {
        List<String> out = new ArrayList<>();
        for (String batch : process(sql)) {
            out.add(batch);
        }
        return out;
    }

    String valueOf(String name) {
        String value = variables.get(name);
        if (value == null) throw SqlCmdException.forVariableNotDefined(name);
        return value;
    }

    /**
     * Returns the scratch buffer, cleared and sized for at least {@code length} characters.
     */
    StringBuilder acquireBuffer(int length) {
        int capacity = BufferSizing.capacityFor(length);
        if (builder == null) {
            builder = new StringBuilder(capacity);
        } else {
            builder.setLength(0);
            builder.ensureCapacity(capacity);
        }
        return builder;
    }

    int scratchBufferCapacity() {
        return builder == null ? 0 : builder.capacity();
    }

    void beginBatch() {
        if (building) {
            throw new IllegalStateException("SqlCmdPreprocessor is already building a batch; nested process calls are not supported");
        }
        building = true;
    }

    void endBatch() {
        building = false;
    }
}
