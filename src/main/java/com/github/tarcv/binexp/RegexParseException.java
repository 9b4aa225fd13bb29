package com.github.tarcv.binexp;

/**
 * Thrown when the text of a pattern can not be parsed.
 * Offsets are in UTF-16 units of the pattern string as seen by the parser.
 */
public class RegexParseException extends UErrorException {
    private final int line;
    private final int offset;
    private final char[] preContext;
    private final char[] postContext;

    public RegexParseException(UErrorCode errorCode, int line, int offset, char[] preContext, char[] postContext) {
        super(errorCode, errorCode + " at line " + line + ", offset " + offset
                + ": \"" + new String(preContext) + "\" ^ \"" + new String(postContext) + "\"");
        this.line = line;
        this.offset = offset;
        this.preContext = preContext;
        this.postContext = postContext;
    }

    public int getLine() {
        return line;
    }

    public int getOffset() {
        return offset;
    }

    public char[] getPreContext() {
        return preContext.clone();
    }

    public char[] getPostContext() {
        return postContext.clone();
    }
}
