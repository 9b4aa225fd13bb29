package com.github.tarcv.binexp;

/**
 * Match Engine State Stack Frame Layout.
 * <p>
 * A view of one block of the backtrack stack: a two slot header followed by the
 * loop start positions the compiler assigned to this pattern.
 */
final class REStackFrame {
    /** Number of stack slots in the header. */
    static final int RESTACKFRAME_HDRCOUNT = 2;

    private final MutableVector64 stack;
    private final int baseOffset;

    REStackFrame(final MutableVector64 stack, final int baseOffset) {
        this.stack = stack;
        this.baseOffset = baseOffset;
    }

    // Header

    /**
     * Position of next symbol in the input
     */
    long fInputIdx() {
        return stack.elementAti(baseOffset);
    }

    void setFInputIdx(final long value) {
        stack.setElementAt(value, baseOffset);
    }

    /**
     * Position of next Op in the compiled pattern
     */
    int fPatIdx() {
        return (int) stack.elementAti(baseOffset + 1);
    }

    void setFPatIdx(final int value) {
        stack.setElementAt(value, baseOffset + 1);
    }

    int postIncrementFPatIdx() {
        int lastValue = fPatIdx();
        setFPatIdx(lastValue + 1);
        return lastValue;
    }

    // Remainder

    /**
     * Loop start positions, used to stop loops whose body matched an empty string.
     * Locations assigned at pattern compile time.
     */
    long fExtra(final int index) {
        return stack.elementAti(baseOffset + RESTACKFRAME_HDRCOUNT + index);
    }

    void setFExtra(final int index, final long value) {
        stack.setElementAt(value, baseOffset + RESTACKFRAME_HDRCOUNT + index);
    }

    int baseOffset() {
        return baseOffset;
    }

    void setFrom(final REStackFrame source, final int frameSize) {
        for (int i = 0; i < frameSize; i++) {
            stack.setElementAt(source.stack.elementAti(source.baseOffset + i), baseOffset + i);
        }
    }

    @Override
    public String toString() {
        return "REStackFrame{" +
                "base=" + baseOffset +
                ", fInputIdx=" + fInputIdx() +
                ", fPatIdx=" + fPatIdx() +
                '}';
    }
}
