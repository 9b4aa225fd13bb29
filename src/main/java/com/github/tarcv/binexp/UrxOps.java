package com.github.tarcv.binexp;

/**
 * Opcodes of the compiled pattern.
 * <p>
 * An op is packed into an int: the type ordinal in the high 8 bits and a 24 bit
 * operand in the low bits. Operands are symbols, pattern locations, set indexes,
 * literal string locations or slots in the stack frame or the matcher's data area.
 */
enum UrxOps {
    URX_RESERVED_OP,    // For multi-operand ops, most non-first words.
    URX_BACKTRACK,      // Force a backtrack, as if a match test had failed.
    URX_END,
    URX_ONECHAR,        // Value field is the symbol to match
    URX_STRING,         // Value field is index of string start
    URX_STRING_LEN,     // Value field is string length (symbols)
    URX_STATE_SAVE,     // Value field is pattern location to push
    URX_NOP,
    URX_SETREF,         // Value field is index of set in array of sets.
    URX_JMP,            // Value field is destination position in the pattern.
    URX_FAIL,           // Stop match operation. No match.
    URX_JMPX,           // Conditional JMP, taken only if the loop made progress.
                        //   Value is the destination; the next op holds the frame slot of the loop start.
    URX_BACKSLASH_A,    // Value field:  not used.
    URX_BACKSLASH_B,    // Value field:  bit 0 set for \B, bit 1 set for ECMAScript word symbols.
    URX_BACKSLASH_Z,    // \Z, end of input or before a final new line.
    URX_BACKSLASH_END,  // \z, end of input.
    URX_CARET,          // Value field:  not used
    URX_CARET_M,        // ^ in multi-line mode.
    URX_DOLLAR,         // Value field:  not used
    URX_DOLLAR_M,       // $ in multi-line mode.
    URX_NOTONECHAR,     // Any symbol except the value field.
    URX_STO_INP_LOC,    // Save the current input position into a frame slot.
    URX_STO_SP,         // Save the stack size into a data slot. Atomic groups.
    URX_LD_SP,          // Cut the stack back to the size saved by URX_STO_SP.
    URX_LA_START,       // Look-ahead start. Saves the stack size and input position into data slots.
    URX_LA_END,         // Look-ahead end. Cuts the stack and restores the input position.
    URX_ONECHAR_I,      // Case-insensitive single symbol, value is the lowercase symbol.
    URX_STRING_I,       // Case-insensitive string compare. Literal is lowercase.
    URX_SETREF_I,       // Case-insensitive set reference. Set is lowercase closed.
    URX_NOTONECHAR_I;   // Case-insensitive inverse of URX_ONECHAR_I.

    private static final UrxOps[] VALUES = values();

    static final int URX_MAX_VALUE = 0x00ffffff;

    static int URX_BUILD(final UrxOps type, final int val) {
        assert val >= 0 && val <= URX_MAX_VALUE;
        return (type.ordinal() << 24) | val;
    }

    static UrxOps URX_TYPE(final int op) {
        return VALUES[op >>> 24];
    }

    static int URX_VAL(final int op) {
        return op & URX_MAX_VALUE;
    }
}
