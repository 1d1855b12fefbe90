package domain.sqlcmd;

/**
 * How the batch under construction is being assembled.
 *
 * <p>Every batch starts in {@link #SUBSTRING}. The switch to {@link #BUILDER} happens at most once
 * per batch and is never reversed.</p>
 */
enum ScanMode {

    /** The batch is a slice of the scanned text; nothing has been copied. */
    SUBSTRING,

    /** The batch is being accumulated in the scratch buffer. */
    BUILDER
}
