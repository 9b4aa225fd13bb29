// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
//
//
/*
 ***************************************************************************
 *   Copyright (C) 2002-2016 International Business Machines Corporation
 *   and others. All rights reserved.
 ***************************************************************************
 */
package com.github.tarcv.binexp;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.github.tarcv.binexp.UErrorCode.U_REGEX_INVALID_FLAG;
import static com.github.tarcv.binexp.URegexpFlag.*;
import static com.github.tarcv.binexp.UrxOps.*;

/**
 * Class `RegexPattern` represents a compiled regular expression.  It includes
 * factory methods for creating a RegexPattern object from the source form
 * of a regular expression, methods for scanning text or binary data for matches,
 * and methods for creating RegexMatchers for finer grained control.
 * <p>
 * A compiled pattern never changes and can be used from several threads at once.
 * Each scan runs on its own {@link RegexMatcher}.
 */
public final class RegexPattern {
    private static final long ALL_FLAGS = UREGEX_CASE_INSENSITIVE.flag | UREGEX_DOTALL.flag
            | UREGEX_MULTILINE.flag | UREGEX_ECMASCRIPT.flag | UREGEX_RAW_BYTES.flag;

    //
    //  Implementation Data
    //

    /**
     * The original pattern, as the symbols it was compiled from.
     */
    final String fPattern;
    /**
     * The flags used when compiling the pattern.
     */
    final long fFlags;
    /**
     * The compiled pattern p-code.
     */
    int[] fCompiledPat;
    /**
     * Literal symbol runs from the pattern, for use during the match.
     * Lowercase for case-insensitive runs.
     */
    int[] fLiteralText;

    /**
     * Any CharSets referenced from the pattern. All frozen.
     */
    List<CharSet> fSets;

    /**
     * Minimum Match Length.  All matches will have length
     * >= this value.
     */
    int fMinMatchLen;

    /**
     * Size of a state stack frame in the
     * execution engine.
     */
    int fFrameSize;

    /**
     * The size of the data needed by the pattern that
     * does not go on the state stack, but has just
     * a single copy per matcher.
     */
    int fDataSize;

    /**
     * Info on how a match must start.
     */
    StartOfMatch fStartType = StartOfMatch.START_NO_INFO;
    int fInitialChar;
    int[] fInitialString;
    CharSet fInitialChars;

    private RegexPattern(final long fFlags, final String regex) {
        this.fFlags = fFlags;
        this.fPattern = regex;
    }

    /**
     * Comparison method.  Two RegexPattern objects are considered equal if they
     * were constructed from identical source patterns using the same #URegexpFlag
     * settings.
     * @param that a RegexPattern object to compare with "this".
     * @return true if the objects are equivalent.
     */
    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof RegexPattern)) {
            return false;
        }
        final RegexPattern other = (RegexPattern) that;
        return this.fFlags == other.fFlags && this.fPattern.equals(other.fPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fFlags, fPattern);
    }

    /**
     * Compiles the regular expression in string form into a RegexPattern
     * object using the specified #URegexpFlag match mode flags.
     *
     * @param regex    The regular expression to be compiled.
     * @param flags    The {@link URegexpFlag} bits, e.g. {@link URegexpFlag#UREGEX_CASE_INSENSITIVE}.
     * @param resolver Resolves \p{..} names that are not Unicode general categories.
     * @return         A regexPattern object for the compiled pattern.
     * @throws RegexParseException for a malformed pattern
     * @throws UErrorException     for unknown flags, unsupported constructs or property names
     */
    public static RegexPattern compile(final String regex,
                                       final long flags,
                                       final UnicodePropertyResolver resolver) {
        if (regex == null) {
            throw new IllegalArgumentException("Pattern must not be null");
        }
        if ((flags & ~ALL_FLAGS) != 0) {
            throw new UErrorException(U_REGEX_INVALID_FLAG);
        }
        RegexPattern This = new RegexPattern(flags, regex);
        RegexCompile.compile(This, regex, resolver == null ? UnicodePropertyResolver.UNSUPPORTED : resolver);
        return This;
    }

    public static RegexPattern compile(final String regex, final long flags) {
        return compile(regex, flags, UnicodePropertyResolver.UNSUPPORTED);
    }

    public static RegexPattern compile(final String regex, final Set<URegexpFlag> flags) {
        return compile(regex, URegexpFlag.toBits(flags));
    }

    /**
     * Compiles with all #URegexpFlag pattern match mode flags set to their default values.
     */
    public static RegexPattern compile(final String regex) {
        return compile(regex, 0);
    }

    /**
     * Compiles a pattern given as bytes.
     * <p>
     * With {@link URegexpFlag#UREGEX_RAW_BYTES} every byte is one pattern symbol, so
     * {@code \xca} followed by {@code [\x00-\xff]} written as raw bytes means exactly
     * those byte values. Otherwise the bytes are decoded as UTF-8 and malformed units
     * become U+FFFD.
     */
    public static RegexPattern compile(final byte[] regex,
                                       final long flags,
                                       final UnicodePropertyResolver resolver) {
        if (regex == null) {
            throw new IllegalArgumentException("Pattern must not be null");
        }
        String decoded = (flags & UREGEX_RAW_BYTES.flag) != 0
                ? new String(regex, StandardCharsets.ISO_8859_1)
                : SymbolText.decodeUtf8(regex);
        return compile(decoded, flags, resolver);
    }

    public static RegexPattern compile(final byte[] regex, final long flags) {
        return compile(regex, flags, UnicodePropertyResolver.UNSUPPORTED);
    }

    public static RegexPattern compile(final byte[] regex, final Set<URegexpFlag> flags) {
        return compile(regex, URegexpFlag.toBits(flags));
    }

    public static RegexPattern compile(final byte[] regex) {
        return compile(regex, 0);
    }

    /**
     * flags
     */
    public long flags() {
        return fFlags;
    }

    /**
     * The flags as a set.
     */
    public Set<URegexpFlag> flagSet() {
        EnumSet<URegexpFlag> result = EnumSet.noneOf(URegexpFlag.class);
        for (URegexpFlag flag : URegexpFlag.values()) {
            if ((fFlags & flag.flag) != 0) {
                result.add(flag);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public boolean isRawBytes() {
        return (fFlags & UREGEX_RAW_BYTES.flag) != 0;
    }

    /**
     * Returns the regular expression from which this pattern was compiled.
     * A byte pattern is returned in its decoded form.
     */
    public String pattern() {
        return fPattern;
    }

    /**
     * Creates a RegexMatcher that will match the given input against this pattern.
     *
     * @param input    The input string to which the regular expression will be applied.
     * @return         A RegexMatcher object for this pattern and input.
     */
    public RegexMatcher matcher(final String input) {
        return matcher().reset(input);
    }

    public RegexMatcher matcher(final SymbolText input) {
        return matcher().reset(input);
    }

    /**
     * Creates a RegexMatcher that will match against this pattern. The matcher has no
     * input until {@link RegexMatcher#reset(SymbolText)} is called.
     */
    public RegexMatcher matcher() {
        return new RegexMatcher(this);
    }

    /**
     * Test whether a string matches a regular expression.  This convenience function
     * both compiles the regular expression and applies it in a single operation.
     *
     * @param regex The regular expression
     * @param input The string data to be matched
     * @return True if the regular expression exactly matches the full input string.
     */
    public static boolean matches(final String regex, final String input) {
        return compile(regex, 0).matcher(input).matches();
    }

    //--------------------------------------------------------------------------
    //
    //    Scanning
    //
    //--------------------------------------------------------------------------

    /**
     * Finds the leftmost match at or after {@code startAt}, scanning the code points of {@code input}.
     *
     * @return the match, or null if there is none
     * @throws IndexOutOfBoundsException if {@code startAt} is negative or past the end of the input
     */
    public Match findStringMatchStartingAt(final String input, final int startAt) {
        return findMatchStartingAt(SymbolText.ofCodePoints(input), startAt);
    }

    /**
     * Like {@link #findStringMatchStartingAt(String, int)} with the input given as UTF-8 bytes.
     * Offsets count decoded code points, malformed units count as one U+FFFD each.
     */
    public Match findStringMatchStartingAt(final byte[] utf8Input, final int startAt) {
        return findMatchStartingAt(SymbolText.ofUtf8(utf8Input), startAt);
    }

    /**
     * Finds the leftmost match at or after {@code startAt}, every byte of {@code input} being one symbol.
     * Offsets count bytes.
     */
    public Match findBytesMatchStartingAt(final byte[] input, final int startAt) {
        return findMatchStartingAt(SymbolText.ofBytes(input), startAt);
    }

    public Match findMatchStartingAt(final SymbolText input, final int startAt) {
        Util.checkOffset(startAt, input.length());
        RegexMatcher m = matcher(input);
        if (m.find(startAt)) {
            return m.toMatch();
        }
        return null;
    }

    /**
     * Finds the next match that starts after {@code previous} ended.
     * An empty match is followed by a scan one symbol further, so the scan always moves forward.
     *
     * @return the match, or null if there is none
     */
    public Match findNextMatch(final Match previous) {
        int next = previous.getIndex() + Math.max(previous.getLength(), 1);
        return findAfter(previous, next);
    }

    /**
     * Finds the next match that starts one symbol after the start of {@code previous}.
     * Matches returned this way can overlap.
     *
     * @return the match, or null if there is none
     */
    public Match findNextOverlappingMatch(final Match previous) {
        return findAfter(previous, previous.getIndex() + 1);
    }

    private Match findAfter(final Match previous, final int next) {
        if (previous.getPattern() != this) {
            throw new IllegalArgumentException("Match was found by another pattern");
        }
        SymbolText text = previous.getText();
        if (next >= text.length()) {
            return null;
        }
        return findMatchStartingAt(text, next);
    }

    //--------------------------------------------------------------------------
    //
    //    Debugging
    //
    //--------------------------------------------------------------------------

    /**
     * The compiled program, one op per line.
     */
    String dumpPattern() {
        StringBuilder sb = new StringBuilder();
        sb.append("Original Pattern:  \"").append(fPattern).append("\"\n");
        sb.append("   Min Match Length:  ").append(fMinMatchLen).append('\n');
        sb.append("   Match Start Type:  ").append(fStartType).append('\n');
        switch (fStartType) {
            case START_CHAR:
                sb.append("    Initial char: ").append(CharSet.charDescription(fInitialChar)).append('\n');
                break;
            case START_STRING:
                sb.append("    Initial string: \"")
                        .append(new String(fInitialString, 0, fInitialString.length)).append("\"\n");
                break;
            case START_SET:
                sb.append("    Match First Chars: ").append(fInitialChars).append('\n');
                break;
            default:
                break;
        }
        sb.append("Sets:\n");
        for (int i = 0; i < fSets.size(); i++) {
            sb.append(String.format("%4d   %s%n", i, fSets.get(i)));
        }
        sb.append("\nIndex   Binary     Type             Operand\n-------------------------------------------\n");
        for (int index = 0; index < fCompiledPat.length; index++) {
            dumpOp(sb, index);
        }
        return sb.toString();
    }

    private void dumpOp(final StringBuilder sb, final int index) {
        int op = fCompiledPat[index];
        UrxOps type = URX_TYPE(op);
        int val = URX_VAL(op);
        sb.append(String.format("%4d   %08x   %-15s  ", index, op, type.name()));
        switch (type) {
            case URX_ONECHAR:
            case URX_ONECHAR_I:
            case URX_NOTONECHAR:
            case URX_NOTONECHAR_I:
                sb.append(CharSet.charDescription(val));
                break;
            case URX_SETREF:
            case URX_SETREF_I:
                sb.append(fSets.get(val));
                break;
            case URX_STRING:
            case URX_STRING_I: {
                int length = URX_VAL(fCompiledPat[index + 1]);
                sb.append('"').append(new String(fLiteralText, val, length)).append('"');
                break;
            }
            case URX_END:
            case URX_FAIL:
            case URX_BACKTRACK:
            case URX_NOP:
            case URX_CARET:
            case URX_CARET_M:
            case URX_DOLLAR:
            case URX_DOLLAR_M:
            case URX_BACKSLASH_A:
            case URX_BACKSLASH_Z:
            case URX_BACKSLASH_END:
                break;
            default:
                sb.append(val);
                break;
        }
        sb.append('\n');
    }
}
