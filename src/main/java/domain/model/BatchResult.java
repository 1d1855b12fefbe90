package domain.model;

/**
 * One row of the preprocessing report: a produced batch, or the failure that ended a script.
 */
public final class BatchResult {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_ERROR = "ERROR";

    private final String status;
    private final String script;
    private final int batchIndex;
    private final int length;
    private final String firstLine;
    private final String errorCode;
    private final String message;

    private BatchResult(String status, String script, int batchIndex, int length,
                        String firstLine, String errorCode, String message) {
        this.status = nullToEmpty(status);
        this.script = nullToEmpty(script);
        this.batchIndex = batchIndex;
        this.length = length;
        this.firstLine = nullToEmpty(firstLine);
        this.errorCode = nullToEmpty(errorCode);
        this.message = nullToEmpty(message);
    }

    public static BatchResult success(String script, int batchIndex, String batch) {
        String text = nullToEmpty(batch);
        return new BatchResult(STATUS_SUCCESS, script, batchIndex, text.length(), firstLine(text), "", "");
    }

    /**
     * @param batchIndex 1-based index of the batch that was being produced when the failure occurred
     */
    public static BatchResult error(String script, int batchIndex, String errorCode, String message) {
        return new BatchResult(STATUS_ERROR, script, batchIndex, 0, "", errorCode, message);
    }

    private static String firstLine(String text) {
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) return line.strip();
        }
        return "";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public String getScript() {
        return script;
    }

    public int getBatchIndex() {
        return batchIndex;
    }

    public int getLength() {
        return length;
    }

    public String getFirstLine() {
        return firstLine;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }
}
