package domain.sqlcmd;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single forward pass over one script, producing one batch per {@link #next()}.
 *
 * <p>A batch is found in {@link ScanMode#SUBSTRING} mode while it contains nothing but plain
 * text, comments and quoted spans without variable references; it is then returned as a slice
 * of the input. The first variable reference or directive switches it to
 * {@link ScanMode#BUILDER} mode: the text scanned so far is copied into the owner's scratch
 * buffer and the rest of the batch is assembled there.</p>
 *
 * <p>Included text is pushed as a new frame and scanned as if it stood in place of the
 * {@code :r} line, in the same batch and mode.</p>
 */
final class BatchScanner implements Iterator<String> {

    private final SqlCmdPreprocessor owner;
    private final DirectiveExecutor directives;
    private final Deque<Frame> frames = new ArrayDeque<>();

    private ScanMode mode = ScanMode.SUBSTRING;
    private int batchStart;
    private StringBuilder builder;

    BatchScanner(SqlCmdPreprocessor owner, String sql) {
        this.owner = owner;
        this.directives = new DirectiveExecutor(owner);
        frames.push(new Frame(sql));
    }

    @Override
    public boolean hasNext() {
        while (!frames.isEmpty() && frames.peek().isExhausted()) {
            frames.pop();
        }
        return !frames.isEmpty();
    }

    @Override
    public String next() {
        if (!hasNext()) throw new NoSuchElementException();

        owner.beginBatch();
        try {
            return scanBatch();
        } catch (RuntimeException e) {
            // a failed scan cannot be resumed
            frames.clear();
            throw e;
        } finally {
            builder = null;
            owner.endBatch();
        }
    }

    private String scanBatch() {
        mode = ScanMode.SUBSTRING;
        batchStart = frames.peek().pos;

        for (;;) {
            Frame f = frames.peek();
            SqlCmdToken t = f.isExhausted() ? null : f.scan.find(f.pos);

            if (t == null) {
                if (frames.size() == 1) {
                    return finishFinalBatch(f);
                }
                // end of included text: the batch goes on in the enclosing frame
                copyTo(f, f.text.length());
                frames.pop();
                continue;
            }

            switch (t.getKind()) {
                case LINE_COMMENT, BLOCK_COMMENT -> {
                    if (mode == ScanMode.BUILDER) copyTo(f, t.getEnd());
                    f.pos = t.getEnd();
                }
                case QUOTED_STRING, QUOTED_IDENTIFIER -> {
                    SqlCmdToken ref = f.scan.findVariable(t.getStart() + 1, t.getEnd());
                    if (ref == null) {
                        if (mode == ScanMode.BUILDER) copyTo(f, t.getEnd());
                    } else {
                        copyTo(f, t.getStart());
                        replaceVariablesIn(f, t.getEnd(), ref);
                    }
                    f.pos = t.getEnd();
                }
                case VARIABLE_REFERENCE -> {
                    copyTo(f, t.getStart());
                    builder.append(owner.valueOf(t.getValue()));
                    f.pos = t.getEnd();
                }
                case BATCH_SEPARATOR -> {
                    String batch;
                    if (mode == ScanMode.SUBSTRING) {
                        batch = f.text.substring(batchStart, t.getStart());
                    } else {
                        copyTo(f, t.getStart());
                        batch = builder.toString();
                    }
                    f.pos = t.getEnd();
                    return batch;
                }
                case SETVAR_DIRECTIVE -> {
                    copyTo(f, t.getStart());
                    f.pos = t.getEnd();
                    directives.setvar(f.text.substring(t.getStart(), t.getEnd()), t.getValue());
                }
                case INCLUDE_DIRECTIVE -> {
                    copyTo(f, t.getStart());
                    f.pos = t.getEnd();
                    String included = directives.include(
                            f.text.substring(t.getStart(), t.getEnd()), t.getValue(), frames.size() - 1);
                    frames.push(new Frame(included));
                }
            }
        }
    }

    private String finishFinalBatch(Frame f) {
        int end = f.text.length();
        if (mode == ScanMode.SUBSTRING) {
            f.pos = end;
            return f.text.substring(batchStart);
        }
        copyTo(f, end);
        return builder.toString();
    }

    /**
     * Appends the unscanned text of {@code f} up to {@code end} to the batch, switching to builder
     * mode first when the batch is still a slice.
     */
    private void copyTo(Frame f, int end) {
        if (mode == ScanMode.SUBSTRING) {
            builder = owner.acquireBuffer(end - batchStart);
            builder.append(f.text, batchStart, end);
            mode = ScanMode.BUILDER;
        } else {
            builder.append(f.text, f.pos, end);
        }
        f.pos = end;
    }

    private void replaceVariablesIn(Frame f, int end, SqlCmdToken ref) {
        while (ref != null) {
            builder.append(f.text, f.pos, ref.getStart());
            builder.append(owner.valueOf(ref.getValue()));
            f.pos = ref.getEnd();
            ref = f.scan.findVariable(f.pos, end);
        }
        builder.append(f.text, f.pos, end);
        f.pos = end;
    }

    private static final class Frame {
        final String text;
        final SqlCmdScan scan;
        int pos;

        Frame(String text) {
            this.text = text;
            this.scan = new SqlCmdScan(text);
        }

        boolean isExhausted() {
            return pos >= text.length();
        }
    }
}
