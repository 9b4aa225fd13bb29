package com.github.tarcv.binexp;

enum StartOfMatch {
    START_NO_INFO,             // No hint available.
    START_CHAR,                // Match starts with a literal symbol.
    START_SET,                 // Match starts with something matching a set.
    START_START,               // Match starts at start of input only (\A, or ^ outside of multi-line mode)
    START_LINE,                // Match starts with ^ in multi-line mode.
    START_STRING               // Match starts with a literal string.
}
