// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
/*
 **************************************************************************
 *   Copyright (C) 2002-2016 International Business Machines Corporation
 *   and others. All rights reserved.
 **************************************************************************
 */
package com.github.tarcv.binexp;

import com.ibm.icu.lang.UCharacter;

import java.util.List;
import java.util.Set;

import static com.github.tarcv.binexp.REStackFrame.RESTACKFRAME_HDRCOUNT;
import static com.github.tarcv.binexp.UrxOps.*;

/**
 * class RegexMatcher bundles together a regular expression pattern and
 * input symbols to which the expression can be applied.  It includes methods
 * for testing for matches and for finding successive matches.
 * <p>
 * A matcher holds the state of one scan and is not safe for use from several threads.
 * Create one per thread from the shared {@link RegexPattern}.
 */
public final class RegexMatcher {
    /**
     * Default limit for the size of the back track stack, to avoid system
     * failures caused by heap exhaustion.  Units are in bytes.
     */
    private static final int DEFAULT_BACKTRACK_STACK_CAPACITY = 8000000;

    /**
     * Time limit counter constant.
     * Time limits for expression evaluation are in terms of quanta of work by
     * the engine, each of which is 10,000 state saves.
     * This constant determines that state saves per tick number.
     */
    private static final int TIMER_INITIAL_VALUE = 10000;

    private final RegexPattern fPattern;

    /**
     * The symbols being matched. Is never null.
     */
    private SymbolText fInputText = SymbolText.empty();
    /**
     * Full length of the input.
     */
    private int fInputLength;
    /**
     * The size of a frame in the backtrack stack.
     */
    private final int fFrameSize;

    /**
     * True if the last attempted match was successful.
     */
    private boolean fMatch;
    /**
     * Position of the start of the most recent match
     */
    private int fMatchStart;
    /**
     * First position after the end of the most recent match
     * Zero if no previous match.
     */
    private int fMatchEnd;
    /**
     * First position after the end of the previous match,
     * or -1 if there was no previous match.
     */
    private int fLastMatchEnd;

    /**
     * True if the last match touched the end of input.
     */
    private boolean fHitEnd;

    /**
     * The backtracking stack.
     */
    private final MutableVector64 fStack;

    /**
     * Data area for use by the compiled pattern.
     */
    private final long[] fData;

    /**
     * Max time (in "steps") to let the match run before giving up. Zero for no limit.
     */
    private int fTimeLimit;

    /**
     * Match time, accumulates while matching.
     */
    private int fTime;
    /**
     * Low bits counter for time.  Counts down StateSaves.
     */
    private int fTickCounter;

    /**
     * Maximum memory size to use for the backtrack
     * stack, in bytes.  Zero for unlimited.
     */
    private int fStackLimit;

    RegexMatcher(final RegexPattern pat) {
        fPattern = pat;
        fFrameSize = pat.fFrameSize;
        fData = new long[Math.max(pat.fDataSize, 1)];
        fStack = new MutableVector64(() -> new UErrorException(UErrorCode.U_REGEX_STACK_OVERFLOW,
                "Backtrack stack exceeded " + fStackLimit + " bytes"));
        setStackLimit(DEFAULT_BACKTRACK_STACK_CAPACITY);
        reset();
    }

    /**
     * Constructs a RegexMatcher for a regular expression.
     * This is a convenience method that avoids the need to explicitly create
     * a RegexPattern object.
     *
     * @param regexp The regular expression to be compiled.
     * @param flags  The {@link URegexpFlag} options.
     */
    public RegexMatcher(final String regexp, final Set<URegexpFlag> flags) {
        this(RegexPattern.compile(regexp, flags));
    }

    /**
     * Constructs a RegexMatcher for a regular expression and an input string.
     *
     * @param regexp The regular expression to be compiled.
     * @param input  The string to match. Its code points are the symbols.
     * @param flags  The {@link URegexpFlag} options.
     */
    public RegexMatcher(final String regexp, final String input, final Set<URegexpFlag> flags) {
        this(regexp, flags);
        reset(input);
    }

    /**
     * Returns the pattern that is interpreted by this matcher.
     */
    public RegexPattern pattern() {
        return fPattern;
    }

    public SymbolText input() {
        return fInputText;
    }

    /**
     *   Resets this matcher.  The effect is to remove any memory of previous matches,
     *       and to cause subsequent find() operations to begin at the beginning of
     *       the input.
     *
     *   @return this RegexMatcher.
     */
    public RegexMatcher reset() {
        fMatch = false;
        fMatchStart = 0;
        fMatchEnd = 0;
        fLastMatchEnd = -1;
        fHitEnd = false;
        fTime = 0;
        fTickCounter = TIMER_INITIAL_VALUE;
        fStack.removeAllElements();
        return this;
    }

    /**
     *   Resets this matcher with new input data.  This allows a single matcher
     *      to be reused with a number of different inputs.
     *
     *   @param input The new symbols on which subsequent pattern matches will operate.
     *   @return this RegexMatcher.
     */
    public RegexMatcher reset(final SymbolText input) {
        if (input == null) {
            throw new IllegalArgumentException("Input must not be null");
        }
        fInputText = input;
        fInputLength = input.length();
        return reset();
    }

    /**
     * Resets with the code points of {@code input}.
     */
    public RegexMatcher reset(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input must not be null");
        }
        return reset(SymbolText.ofCodePoints(input));
    }

    /**
     *   Attempts to match the entire input against the pattern.
     *    @return true if there is a match
     *    @throws UErrorException if the time or stack limit is exceeded
     */
    public boolean matches() {
        reset();
        MatchAt(0, true);
        return fMatch;
    }

    /**
     *   Attempts to match the input, starting from the beginning.
     *   Unlike {@link #matches()}, the match does not need to extend to the end of the input.
     *    @return true if there is a match at the start of the input.
     */
    public boolean lookingAt() {
        reset();
        MatchAt(0, false);
        return fMatch;
    }

    /**
     *  Find the next pattern match in the input.
     *  The find begins searching the input at the location following the end of
     *  the previous match, or at the start of the input if there is no previous match.
     *  After an empty match the search begins one symbol further.
     *  @return  true if a match is found.
     */
    public boolean find() {
        int startPos = fMatchEnd;

        if (fMatch) {
            // Save the position of any previous successful match.
            fLastMatchEnd = fMatchEnd;

            if (fMatchStart == fMatchEnd) {
                // Previous match had zero length.  Move start position up one position
                //  to avoid sending find() into a loop on zero-length matches.
                startPos++;
            }
        } else {
            if (fLastMatchEnd >= 0) {
                // A previous find() failed to match.  Don't try again.
                fHitEnd = true;
                return false;
            }
        }
        return findFrom(startPos);
    }

    /**
     *   Resets this RegexMatcher and then attempts to find the next substring of the
     *   input that matches the pattern, starting at the specified index.
     *   A start equal to the input length never matches.
     *
     *   @param start     The (symbol) index in the input to begin the search.
     *   @return  true if a match is found.
     *   @throws IndexOutOfBoundsException if start is negative or beyond the end of the input
     */
    public boolean find(final long start) {
        Util.checkOffset(start, fInputLength);
        reset();
        return findFrom((int) start);
    }

    /**
     * Tries every candidate position in [startPos, input length) the start hint allows,
     * leftmost first.
     */
    private boolean findFrom(final int startPos) {
        fMatch = false;
        if (startPos >= fInputLength) {
            fHitEnd = true;
            return false;
        }

        // Compute the position in the input beyond which a match can not begin, because
        //   the minimum length match would extend past the end of the input.
        //   Note:  some patterns that cannot match anything will have fMinMatchLen==Max Int.
        int testStartLimit = Math.min(fInputLength - 1, fInputLength - fPattern.fMinMatchLen);
        if (startPos > testStartLimit) {
            fHitEnd = true;
            return false;
        }

        switch (fPattern.fStartType) {
            case START_START:
                // Matches are only possible at the start of the input
                //   (pattern begins with \A, or ^ outside of multi-line mode)
                if (startPos > 0) {
                    return false;
                }
                MatchAt(startPos, false);
                return fMatch;

            case START_NO_INFO:
                // No optimization was found.
                //  Try a match at each input position.
                for (int pos = startPos; pos <= testStartLimit; pos++) {
                    MatchAt(pos, false);
                    if (fMatch) {
                        return true;
                    }
                }
                break;

            case START_CHAR:
                // Match starts on exactly one symbol.
                for (int pos = startPos; pos <= testStartLimit; pos++) {
                    if (fInputText.symbolAt(pos) == fPattern.fInitialChar) {
                        MatchAt(pos, false);
                        if (fMatch) {
                            return true;
                        }
                    }
                }
                break;

            case START_STRING:
                // Match starts on a literal run.
                for (int pos = startPos; pos <= testStartLimit; pos++) {
                    if (regionMatches(pos, fPattern.fInitialString)) {
                        MatchAt(pos, false);
                        if (fMatch) {
                            return true;
                        }
                    }
                }
                break;

            case START_SET:
                // Match may start on any symbol from a set.
                for (int pos = startPos; pos <= testStartLimit; pos++) {
                    if (fPattern.fInitialChars.charIn(fInputText.symbolAt(pos))) {
                        MatchAt(pos, false);
                        if (fMatch) {
                            return true;
                        }
                    }
                }
                break;

            case START_LINE:
                // Multi-line ^: only at the start of input and after a new line.
                for (int pos = startPos; pos <= testStartLimit; pos++) {
                    if (pos == 0 || fInputText.symbolAt(pos - 1) == 0x0a) {
                        MatchAt(pos, false);
                        if (fMatch) {
                            return true;
                        }
                    }
                }
                break;

            default:
                throw new IllegalStateException("Unknown start type " + fPattern.fStartType);
        }
        fHitEnd = true;
        return false;
    }

    private boolean regionMatches(final int pos, final int[] literal) {
        if (pos + literal.length > fInputLength) {
            return false;
        }
        for (int i = 0; i < literal.length; i++) {
            if (fInputText.symbolAt(pos + i) != literal[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     *   Returns the index in the input of the start of the text matched
     *   during the previous match operation.
     *    @throws IllegalStateException if no match has been
     *                        attempted or the last match failed
     */
    public int start() {
        checkMatch();
        return fMatchStart;
    }

    /**
     *    Returns the index in the input of the first symbol following the
     *    text matched during the previous match operation.
     *    @throws IllegalStateException if no match has been
     *                        attempted or the last match failed
     */
    public int end() {
        checkMatch();
        return fMatchEnd;
    }

    /**
     *   Returns the text matched by the previous match operation.
     *   Raw byte symbols come out as the chars U+0000..U+00FF.
     */
    public String group() {
        checkMatch();
        return fInputText.substring(fMatchStart, fMatchEnd);
    }

    /**
     * The previous match as a value that outlives this matcher, or null if the last
     * match attempt failed.
     */
    public Match toMatch() {
        if (!fMatch) {
            return null;
        }
        return new Match(fPattern, fInputText, fMatchStart, fMatchEnd - fMatchStart);
    }

    private void checkMatch() {
        if (!fMatch) {
            throw new IllegalStateException("No match available");
        }
    }

    /**
     * Return true if this matcher's most recent match operation touched
     * the end of the input.
     */
    public boolean hitEnd() {
        return fHitEnd;
    }

    /**
     * Set a processing time limit for match operations with this Matcher.
     * <p>
     *   Some patterns, when matching certain strings, can run in exponential time.
     *   For practical purposes, the match operation may appear to be in an
     *   infinite loop.
     *   When a limit is set a match operation will fail with an error if the
     *   limit is exceeded.
     * <p>
     *   The units of the limit are steps of the match engine, each of which is
     *   ten thousand state saves.
     * <p>
     *   By default, the matching time is not limited.
     *
     *   @param   limit       The limit value, or 0 for no limit.
     */
    public void setTimeLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException();
        }
        fTimeLimit = limit;
    }

    /**
     * Get the time limit, if any, for match operations made with this Matcher.
     *
     *   @return the maximum allowed time for a match, in units of processing steps.
     */
    public int getTimeLimit() {
        return fTimeLimit;
    }

    /**
     *  Set the amount of heap storage available for use by the match backtracking stack.
     *  The matcher is also reset, discarding any results from previous matches.
     * <p>
     *  A limit is desirable because a malicious or poorly designed pattern can use
     *  excessive memory.  A limit is enabled by default.
     *
     *  @param limit  The maximum size, in bytes, of the matching backtrack stack.
     *                A value of zero means no limit.
     *                The limit must be greater or equal to zero.
     */
    public void setStackLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException();
        }

        // Reset the matcher, a current stack may not fit into a smaller limit.
        reset();

        if (limit == 0) {
            // Unlimited stack expansion
            fStack.setMaxCapacity(0);
        } else {
            // Change the units of the limit from bytes to stack slots, and bump the size up
            //   to be big enough to hold the prologue frames, if it isn't there already.
            int adjustedLimit = limit / 8;
            if (adjustedLimit < 2 * fFrameSize) {
                adjustedLimit = 2 * fFrameSize;
            }
            fStack.setMaxCapacity(adjustedLimit);
        }
        fStackLimit = limit;
    }

    /**
     *  Get the size of the heap storage available for use by the back tracking stack.
     *
     *  @return  the maximum backtracking stack size, in bytes, or zero if the
     *           stack size is unlimited.
     */
    public int getStackLimit() {
        return fStackLimit;
    }

    //================================================================================
    //
    //    Code following this point in this file is the internal
    //    Match Engine Implementation.
    //
    //================================================================================

    /**
     * Discard any previous contents of the state save stack, and initialize a
     * new stack frame with all loop start positions at -1.
     */
    private REStackFrame resetStack() {
        fStack.removeAllElements();

        REStackFrame iFrame = fStack.reserveBlock(fFrameSize);
        for (int i = 0; i < fFrameSize - RESTACKFRAME_HDRCOUNT; i++) {
            iFrame.setFExtra(i, -1);
        }
        return iFrame;
    }

    /**
     * \b test, .NET style: a boundary is where exactly one of the symbols around
     * {@code pos} is a word symbol. Positions outside of the input count as non-word.
     */
    private boolean isWordBoundary(final int pos, final boolean ecma) {
        boolean before = pos > 0 && isWordSymbol(fInputText.symbolAt(pos - 1), ecma);
        boolean after = pos < fInputLength && isWordSymbol(fInputText.symbolAt(pos), ecma);
        return before != after;
    }

    private static boolean isWordSymbol(final int c, final boolean ecma) {
        return ecma ? CharSet.isEcmaWordChar(c) : CharSet.isWordChar(c);
    }

    /**
     * This function is called once each TIMER_INITIAL_VALUE state
     * saves. Increment the "time" counter, and abort the match
     * by throwing if the time limit is reached.
     */
    private void IncrementTime() {
        fTickCounter = TIMER_INITIAL_VALUE;
        fTime++;
        if (fTimeLimit > 0 && fTime >= fTimeLimit) {
            throw new UErrorException(UErrorCode.U_REGEX_TIME_OUT);
        }
    }

    /**
     * Make a new stack frame, initialized as a copy of the current stack frame.
     * Set the pattern index in the original stack frame from the operand value
     * in the opcode.  Execution of the engine continues with the state in
     * the newly created stack frame.
     *
     * @param savePatIdx   An index into the compiled pattern.  Goes into the original
     *                     (not new) frame.  If execution ever back-tracks out of the
     *                     new frame, this will be where we continue from in the pattern.
     * @return The new frame pointer.
     */
    private REStackFrame StateSave(final int savePatIdx) {
        REStackFrame fp = fStack.getLastBlock(fFrameSize);
        // push storage for a new frame.
        REStackFrame newFP = fStack.reserveBlock(fFrameSize);

        // New stack frame = copy of old top frame.
        newFP.setFrom(fp, fFrameSize);

        fTickCounter--;
        if (fTickCounter <= 0) {
            IncrementTime();    // Re-initializes fTickCounter
        }
        fp.setFPatIdx(savePatIdx);
        return newFP;
    }

    /**
     * Moves the current frame down to {@code newStackSize}, discarding every frame above it.
     */
    private REStackFrame cutStack(final REStackFrame fp, final int newStackSize) {
        assert newStackSize <= fStack.size();
        if (newStackSize == fStack.size()) {
            return fp;
        }
        REStackFrame newFP = new REStackFrame(fStack, newStackSize - fFrameSize);
        newFP.setFrom(fp, fFrameSize);
        fStack.setSize(newStackSize);
        return newFP;
    }

    private int symbolFold(final int c) {
        return UCharacter.toLowerCase(c);
    }

    /**
     * This is the actual matching engine.
     * @param startIdx    begin matching a this index.
     * @param toEnd       if true, match must extend to end of the input
     */
    private void MatchAt(final int startIdx, final boolean toEnd) {
        boolean isMatch = false;      // True if the we have a match.

        int op;                    // Operation from the compiled pattern, split into
        UrxOps opType;             //    the opcode
        int opValue;               //    and the operand value.

        //  Cache frequently referenced items from the compiled pattern
        //
        final int[] pat = fPattern.fCompiledPat;
        final int[] litText = fPattern.fLiteralText;
        final List<CharSet> sets = fPattern.fSets;

        REStackFrame fp = resetStack();

        fp.setFPatIdx(0);
        fp.setFInputIdx(startIdx);

        // Zero out the pattern's static data
        for (int i = 0; i < fPattern.fDataSize; i++) {
            fData[i] = 0;
        }

        //
        //  Main loop for interpreting the compiled pattern.
        //  One iteration of the loop per pattern operation performed.
        //
        breakFromLoop:
        for (; ; ) {
            op = pat[fp.postIncrementFPatIdx()];
            opType = URX_TYPE(op);
            opValue = URX_VAL(op);

            switch (opType) {

                case URX_NOP:
                    break;

                case URX_BACKTRACK:
                    // Force a backtrack.  The end of a negative look-ahead whose
                    //   body matched gets here.
                    fp = fStack.popFrame(fFrameSize);
                    break;

                case URX_ONECHAR:
                case URX_ONECHAR_I:
                case URX_NOTONECHAR:
                case URX_NOTONECHAR_I: {
                    int inputIdx = (int) fp.fInputIdx();
                    if (inputIdx >= fInputLength) {
                        fHitEnd = true;
                        fp = fStack.popFrame(fFrameSize);
                        break;
                    }
                    int c = fInputText.symbolAt(inputIdx);
                    if (opType == URX_ONECHAR_I || opType == URX_NOTONECHAR_I) {
                        // The symbol from the pattern is already lowercase.
                        c = symbolFold(c);
                    }
                    boolean expectEqual = opType == URX_ONECHAR || opType == URX_ONECHAR_I;
                    if ((c == opValue) == expectEqual) {
                        fp.setFInputIdx(inputIdx + 1);
                    } else {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                case URX_STRING:
                case URX_STRING_I: {
                    // Test input against a literal string.
                    // Strings require two slots in the compiled pattern, one for the
                    //   offset to the string text, and one for the length.
                    int stringStartIdx = opValue;
                    op = pat[fp.postIncrementFPatIdx()];     // Fetch the second operand
                    assert URX_TYPE(op) == URX_STRING_LEN;
                    int stringLen = URX_VAL(op);
                    assert stringLen >= 2;

                    int inputIdx = (int) fp.fInputIdx();
                    boolean success = true;
                    for (int i = 0; i < stringLen; i++) {
                        if (inputIdx + i >= fInputLength) {
                            success = false;
                            fHitEnd = true;
                            break;
                        }
                        int c = fInputText.symbolAt(inputIdx + i);
                        if (opType == URX_STRING_I) {
                            c = symbolFold(c);
                        }
                        if (c != litText[stringStartIdx + i]) {
                            success = false;
                            break;
                        }
                    }

                    if (success) {
                        fp.setFInputIdx(inputIdx + stringLen);
                    } else {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                case URX_SETREF:
                case URX_SETREF_I: {
                    assert opValue >= 0 && opValue < sets.size();
                    int inputIdx = (int) fp.fInputIdx();
                    if (inputIdx >= fInputLength) {
                        fHitEnd = true;
                        fp = fStack.popFrame(fFrameSize);
                        break;
                    }
                    int c = fInputText.symbolAt(inputIdx);
                    if (opType == URX_SETREF_I) {
                        c = symbolFold(c);
                    }
                    if (sets.get(opValue).charIn(c)) {
                        fp.setFInputIdx(inputIdx + 1);
                    } else {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                case URX_STATE_SAVE:
                    fp = StateSave(opValue);
                    break;

                case URX_END:
                    // The match loop will exit via this path on a successful match,
                    //   when we reach the end of the pattern.
                    if (toEnd && fp.fInputIdx() != fInputLength) {
                        // The pattern matched, but not to the end of input.  Try some more.
                        fp = fStack.popFrame(fFrameSize);
                        break;
                    }
                    isMatch = true;
                    break breakFromLoop;

                case URX_FAIL:
                    isMatch = false;
                    break breakFromLoop;

                case URX_JMP:
                    fp.setFPatIdx(opValue);
                    break;

                case URX_JMPX: {
                    int dataLoc = URX_VAL(pat[fp.postIncrementFPatIdx()]);
                    assert dataLoc >= 0 && dataLoc < fFrameSize - RESTACKFRAME_HDRCOUNT;
                    long savedInputIdx = fp.fExtra(dataLoc);
                    assert savedInputIdx <= fp.fInputIdx();
                    if (savedInputIdx < fp.fInputIdx()) {
                        fp.setFPatIdx(opValue);                               // JMP
                    } else {
                        fp = fStack.popFrame(fFrameSize);   // FAIL, no progress in loop.
                    }
                }
                break;

                case URX_STO_INP_LOC:
                    assert opValue >= 0 && opValue < fFrameSize - RESTACKFRAME_HDRCOUNT;
                    fp.setFExtra(opValue, fp.fInputIdx());
                    break;

                case URX_STO_SP:
                    // Entering an atomic group.
                    assert opValue >= 0 && opValue < fPattern.fDataSize;
                    fData[opValue] = fStack.size();
                    break;

                case URX_LD_SP:
                    // Leaving an atomic group: no backtracking into it from now on.
                    assert opValue >= 0 && opValue < fPattern.fDataSize;
                    fp = cutStack(fp, (int) fData[opValue]);
                    break;

                case URX_LA_START:
                    // Entering a look-ahead block.
                    // Save Stack Ptr, Input Pos.
                    assert opValue >= 0 && opValue + 1 < fPattern.fDataSize;
                    fData[opValue] = fStack.size();
                    fData[opValue + 1] = fp.fInputIdx();
                    break;

                case URX_LA_END:
                    // Leaving a look-ahead block.
                    //  restore Stack Ptr, Input Pos to positions they had on entry to block.
                    assert opValue >= 0 && opValue + 1 < fPattern.fDataSize;
                    fp = cutStack(fp, (int) fData[opValue]);
                    fp.setFInputIdx(fData[opValue + 1]);
                    break;

                case URX_CARET:
                case URX_BACKSLASH_A:
                    //  ^ and \A, test for start of input
                    if (fp.fInputIdx() != 0) {
                        fp = fStack.popFrame(fFrameSize);
                    }
                    break;

                case URX_CARET_M: {
                    //  ^, test for start of line in multi-line mode
                    int inputIdx = (int) fp.fInputIdx();
                    if (inputIdx != 0 && fInputText.symbolAt(inputIdx - 1) != 0x0a) {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                case URX_DOLLAR:
                case URX_BACKSLASH_Z: {
                    //  $ and \Z, test for end of input
                    //     or for position before new line at end of input
                    int inputIdx = (int) fp.fInputIdx();
                    if (inputIdx >= fInputLength) {
                        fHitEnd = true;
                        break;
                    }
                    if (inputIdx == fInputLength - 1 && fInputText.symbolAt(inputIdx) == 0x0a) {
                        fHitEnd = true;
                        break;
                    }
                    fp = fStack.popFrame(fFrameSize);
                }
                break;

                case URX_DOLLAR_M: {
                    //  $, test for end of line in multi-line mode
                    int inputIdx = (int) fp.fInputIdx();
                    if (inputIdx >= fInputLength) {
                        fHitEnd = true;
                        break;
                    }
                    if (fInputText.symbolAt(inputIdx) != 0x0a) {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                case URX_BACKSLASH_END:
                    // \z, only at the end of input
                    if (fp.fInputIdx() >= fInputLength) {
                        fHitEnd = true;
                    } else {
                        fp = fStack.popFrame(fFrameSize);
                    }
                    break;

                case URX_BACKSLASH_B: {
                    // Test for word boundaries
                    boolean success = isWordBoundary((int) fp.fInputIdx(), (opValue & 2) != 0);
                    success ^= (opValue & 1) != 0;     // flip sense for \B
                    if (!success) {
                        fp = fStack.popFrame(fFrameSize);
                    }
                }
                break;

                default:
                    // Trouble.  The compiled pattern contains an entry with an
                    //           unrecognized type tag.
                    throw new UErrorException(UErrorCode.U_REGEX_INTERNAL_ERROR,
                            "Unexpected op " + opType + " at " + (fp.fPatIdx() - 1));
            }
        }

        fMatch = isMatch;
        if (isMatch) {
            fMatchStart = startIdx;
            fMatchEnd = (int) fp.fInputIdx();
        }
    }
}
