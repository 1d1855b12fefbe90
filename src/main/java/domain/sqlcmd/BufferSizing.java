package domain.sqlcmd;

/** Capacity rules for the reusable scratch buffer. */
final class BufferSizing {

    static final int MINIMUM_BUFFER_SIZE = 4096;

    private BufferSizing() {
    }

    /**
     * Rounds up to the next power of two, saturating at {@link Integer#MAX_VALUE}.
     * Returns 0 for 0; undefined for negative values.
     */
    static int nextPowerOf2Saturating(int value) {
        value--;
        value |= value >> 1;
        value |= value >> 2;
        value |= value >> 4;
        value |= value >> 8;
        value |= value >> 16;

        return value == Integer.MAX_VALUE ? value : value + 1;
    }

    static int capacityFor(int length) {
        return length < MINIMUM_BUFFER_SIZE ? MINIMUM_BUFFER_SIZE : nextPowerOf2Saturating(length);
    }
}
