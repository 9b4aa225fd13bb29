package com.github.tarcv.binexp;

final class Util {
    /** Chars of pattern context kept on each side of a syntax error. */
    static final int U_PARSE_CONTEXT_LEN = 16;

    private Util() {
    }

    /**
     * Checks an offset into an input of {@code length} symbols. The end of input is a valid offset.
     *
     * @throws IndexOutOfBoundsException if the offset is outside [0, length]
     */
    static void checkOffset(final long offset, final int length) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " is outside of [0, " + length + "]");
        }
    }
}
