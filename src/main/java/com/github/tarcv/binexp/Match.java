package com.github.tarcv.binexp;

import java.util.Objects;

/**
 * A successful match: start index and length in symbols of the scanned input.
 * <p>
 * A match remembers the pattern and the input it was found in, so that a scan can
 * be resumed with {@link RegexPattern#findNextMatch(Match)} or
 * {@link RegexPattern#findNextOverlappingMatch(Match)}.
 */
public final class Match {
    private final RegexPattern pattern;
    private final SymbolText text;
    private final int index;
    private final int length;

    Match(final RegexPattern pattern, final SymbolText text, final int index, final int length) {
        assert index >= 0 && length >= 0 && index + length <= text.length();
        this.pattern = pattern;
        this.text = text;
        this.index = index;
        this.length = length;
    }

    /**
     * Zero-based start of the match, in code points or bytes depending on the scan.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Number of symbols matched.
     */
    public int getLength() {
        return length;
    }

    /**
     * First position after the match.
     */
    public int getEnd() {
        return index + length;
    }

    /**
     * The matched symbols as a string. Byte symbols map to U+0000..U+00FF.
     */
    public String getValue() {
        return text.substring(index, index + length);
    }

    RegexPattern getPattern() {
        return pattern;
    }

    SymbolText getText() {
        return text;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        Match match = (Match) o;
        return index == match.index && length == match.length
                && pattern.equals(match.pattern) && text.equals(match.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, length);
    }

    @Override
    public String toString() {
        return "Match{" +
                "index=" + index +
                ", length=" + length +
                '}';
    }
}
