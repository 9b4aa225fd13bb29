package com.github.tarcv.binexp;

import java.util.Collection;

public enum URegexpFlag {
    /**
     * Enable case insensitive matching.
     */
    UREGEX_CASE_INSENSITIVE(2),

    /**
     * If set, '.' matches line terminators,  otherwise '.' matching stops at line end.
     */
    UREGEX_DOTALL(32),

    /**
     * Control behavior of "$" and "^"
     * If set, recognize line terminators within string,
     * otherwise, match only at start and end of input string.
     */
    UREGEX_MULTILINE(8),

    /**
     * ECMAScript classes.
     * If set, \d, \w and \s denote the ASCII-only ECMAScript classes
     * instead of the Unicode category based ones.
     */
    UREGEX_ECMASCRIPT(1024),

    /**
     * Raw byte symbols.
     * If set, every byte 0x00..0xff of a byte pattern and of a byte input is one
     * symbol, regardless of whether the bytes form valid UTF-8.
     */
    UREGEX_RAW_BYTES(2048);

    final long flag;

    URegexpFlag(final int flag) {
        this.flag = flag;
    }

    static long toBits(final Collection<URegexpFlag> flags) {
        long bits = 0;
        for (URegexpFlag f : flags) {
            bits |= f.flag;
        }
        return bits;
    }
}
