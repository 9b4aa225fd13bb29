package com.github.tarcv.binexp;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An input as a sequence of symbols, the unit that match positions and lengths
 * are counted in.
 * <p>
 * In code point mode a symbol is a decoded code point. In raw byte mode a symbol
 * is a byte value 0x00..0xff, whether or not the bytes are valid UTF-8.
 * Instances never change and can be shared between threads.
 */
public final class SymbolText {
    private static final SymbolText EMPTY = new SymbolText(new int[0], false);

    private final int[] symbols;
    private final boolean rawBytes;

    private SymbolText(final int[] symbols, final boolean rawBytes) {
        this.symbols = symbols;
        this.rawBytes = rawBytes;
    }

    static SymbolText empty() {
        return EMPTY;
    }

    /**
     * Code points of a string. An unpaired surrogate is a symbol of its own.
     */
    public static SymbolText ofCodePoints(final String text) {
        return new SymbolText(text.codePoints().toArray(), false);
    }

    /**
     * Code points of UTF-8 encoded bytes. A malformed unit decodes to U+FFFD and
     * still occupies a symbol position.
     */
    public static SymbolText ofUtf8(final byte[] utf8) {
        return new SymbolText(decodeUtf8(utf8).codePoints().toArray(), false);
    }

    /**
     * Every byte as one symbol.
     */
    public static SymbolText ofBytes(final byte[] data) {
        int[] symbols = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            symbols[i] = data[i] & 0xff;
        }
        return new SymbolText(symbols, true);
    }

    static String decodeUtf8(final byte[] utf8) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(utf8));
            return decoded.toString();
        } catch (CharacterCodingException e) {
            // REPLACE never reports errors
            throw new IllegalStateException(e);
        }
    }

    /**
     * Number of symbols.
     */
    public int length() {
        return symbols.length;
    }

    public int symbolAt(final int index) {
        return symbols[index];
    }

    public boolean isRawBytes() {
        return rawBytes;
    }

    /**
     * Text of a range of symbols. Byte symbols map to the characters U+0000..U+00FF.
     */
    public String substring(final int start, final int end) {
        return new String(symbols, start, end - start);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolText)) return false;
        SymbolText that = (SymbolText) o;
        return rawBytes == that.rawBytes && Arrays.equals(symbols, that.symbols);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(symbols) + (rawBytes ? 1 : 0);
    }

    @Override
    public String toString() {
        return "SymbolText{" +
                (rawBytes ? "bytes" : "codePoints") +
                ", length=" + symbols.length +
                '}';
    }
}
