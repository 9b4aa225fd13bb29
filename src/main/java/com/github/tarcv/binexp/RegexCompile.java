package com.github.tarcv.binexp;

import com.ibm.icu.lang.UCharacter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.tarcv.binexp.UErrorCode.U_REGEX_PATTERN_TOO_BIG;
import static com.github.tarcv.binexp.UrxOps.*;

/**
 * Compiles a parsed pattern tree into the p-code run by {@link RegexMatcher}.
 * <p>
 * Every compiled pattern starts with the same prologue:
 * <pre>
 *   0   STATE_SAVE  2     backtracking out of everything lands on the FAIL
 *   1   JMP         3
 *   2   FAIL
 *   3   ...               the pattern body, then END
 * </pre>
 */
final class RegexCompile {
    private static final Logger LOGGER = Logger.getLogger(RegexCompile.class.getName());

    private final RegexPattern fRXPat;

    private final MutableVector32 fCompiledPat = new MutableVector32();
    private final MutableVector32 fLiteralText = new MutableVector32();
    private final List<CharSet> fSets = new ArrayList<>();
    private final Map<CharSet, Integer> fSetIndexes = new HashMap<>();

    /** Frame slots past the header, one per loop whose body can match an empty string. */
    private int fFrameExtras;
    private int fDataSize;

    private RegexCompile(final RegexPattern rxp) {
        this.fRXPat = rxp;
    }

    /**
     * Parses and compiles {@code regex}, filling in the implementation data of {@code rxp}.
     */
    static void compile(final RegexPattern rxp, final String regex, final UnicodePropertyResolver resolver) {
        RegexNode tree = RegexParser.parse(regex, rxp.fFlags, resolver);
        new RegexCompile(rxp).compileTree(tree);
    }

    private void compileTree(final RegexNode tree) {
        appendOp(URX_STATE_SAVE, 2);
        appendOp(URX_JMP, 3);
        appendOp(URX_FAIL, 0);

        compileNode(tree);
        appendOp(URX_END, 0);

        fRXPat.fCompiledPat = fCompiledPat.toArray();
        fRXPat.fLiteralText = fLiteralText.toArray();
        fRXPat.fSets = fSets;
        fRXPat.fFrameSize = REStackFrame.RESTACKFRAME_HDRCOUNT + fFrameExtras;
        fRXPat.fDataSize = fDataSize;
        fRXPat.fMinMatchLen = tree.minLength();
        matchStartType(tree);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Compiled " + fRXPat.pattern() + " from " + tree + "\n" + fRXPat.dumpPattern());
        }
    }

    //------------------------------------------------------------------------------
    //
    //   Code generation
    //
    //------------------------------------------------------------------------------

    private void compileNode(final RegexNode node) {
        switch (node.type) {
            case ONE:
                appendOp(node.ignoreCase ? URX_ONECHAR_I : URX_ONECHAR, caseOf(node.ch, node.ignoreCase));
                break;
            case MULTI:
                compileString(node.str, node.ignoreCase);
                break;
            case SET:
                compileSet(node.set, node.ignoreCase);
                break;
            case EMPTY:
                break;
            case CONCATENATE:
                for (RegexNode child : node.children()) {
                    compileNode(child);
                }
                break;
            case ALTERNATE:
                compileAlternation(node);
                break;
            case GROUP:
                compileNode(node.child(0));
                break;
            case LOOP:
                compileLoop(node);
                break;
            case REQUIRE: {
                int dataLoc = allocateData(2);
                appendOp(URX_LA_START, dataLoc);
                compileNode(node.child(0));
                appendOp(URX_LA_END, dataLoc);
                break;
            }
            case PREVENT: {
                //   LA_START   dataLoc
                //   STATE_SAVE after
                //   ...body
                //   LA_END     dataLoc
                //   BACKTRACK         body matched, so the whole lookahead fails
                // after:
                //   LA_END     dataLoc
                int dataLoc = allocateData(2);
                appendOp(URX_LA_START, dataLoc);
                int saveLoc = appendOp(URX_STATE_SAVE, 0);
                compileNode(node.child(0));
                appendOp(URX_LA_END, dataLoc);
                appendOp(URX_BACKTRACK, 0);
                fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
                appendOp(URX_LA_END, dataLoc);
                break;
            }
            case ATOMIC: {
                int dataLoc = allocateData(1);
                appendOp(URX_STO_SP, dataLoc);
                compileNode(node.child(0));
                appendOp(URX_LD_SP, dataLoc);
                break;
            }
            case BOL:
                appendOp(node.multiline ? URX_CARET_M : URX_CARET, 0);
                break;
            case EOL:
                appendOp(node.multiline ? URX_DOLLAR_M : URX_DOLLAR, 0);
                break;
            case BEGINNING:
                appendOp(URX_BACKSLASH_A, 0);
                break;
            case END:
                appendOp(URX_BACKSLASH_END, 0);
                break;
            case ENDZ:
                appendOp(URX_BACKSLASH_Z, 0);
                break;
            case BOUNDARY:
            case NONBOUNDARY:
                appendOp(URX_BACKSLASH_B, (node.type == RegexNode.Type.NONBOUNDARY ? 1 : 0) | (node.ecma ? 2 : 0));
                break;
            default:
                throw new UErrorException(UErrorCode.U_REGEX_INTERNAL_ERROR, "Unexpected node " + node.type);
        }
    }

    private static int caseOf(final int ch, final boolean ignoreCase) {
        return ignoreCase ? UCharacter.toLowerCase(ch) : ch;
    }

    private void compileString(final int[] str, final boolean ignoreCase) {
        if (str.length == 1) {
            appendOp(ignoreCase ? URX_ONECHAR_I : URX_ONECHAR, caseOf(str[0], ignoreCase));
            return;
        }
        int stringStart = fLiteralText.size();
        for (int ch : str) {
            fLiteralText.addElement(caseOf(ch, ignoreCase));
        }
        checkOperand(stringStart);
        appendOp(ignoreCase ? URX_STRING_I : URX_STRING, stringStart);
        appendOp(URX_STRING_LEN, str.length);
    }

    /**
     * Sets of one symbol become single symbol ops, anything else is interned by value
     * and referenced by index. Case-insensitive sets are closed over lowercase first.
     */
    private void compileSet(final CharSet set, final boolean ignoreCase) {
        CharSet effective = set;
        if (ignoreCase) {
            effective = set.cloneAsThawed();
            effective.addLowercase();
        }
        if (effective.isSingleton()) {
            appendOp(ignoreCase ? URX_ONECHAR_I : URX_ONECHAR, effective.singletonChar());
            return;
        }
        if (effective.isSingletonInverse()) {
            appendOp(ignoreCase ? URX_NOTONECHAR_I : URX_NOTONECHAR, effective.singletonChar());
            return;
        }
        appendOp(ignoreCase ? URX_SETREF_I : URX_SETREF, internSet(effective));
    }

    private int internSet(final CharSet set) {
        Integer existing = fSetIndexes.get(set);
        if (existing != null) {
            return existing;
        }
        CharSet frozen = set.isFrozen() ? set : set.cloneAsThawed().freeze();
        int index = fSets.size();
        checkOperand(index);
        fSets.add(frozen);
        fSetIndexes.put(frozen, index);
        return index;
    }

    /**
     * <pre>
     *   STATE_SAVE  next1
     *   ...first alternative
     *   JMP         end
     * next1:
     *   STATE_SAVE  next2
     *   ...
     * nextN:
     *   ...last alternative
     * end:
     * </pre>
     */
    private void compileAlternation(final RegexNode node) {
        List<Integer> jumpsToEnd = new ArrayList<>();
        int last = node.children.size() - 1;
        for (int i = 0; i < last; i++) {
            int saveLoc = appendOp(URX_STATE_SAVE, 0);
            compileNode(node.child(i));
            jumpsToEnd.add(appendOp(URX_JMP, 0));
            fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
        }
        compileNode(node.child(last));
        for (int jumpLoc : jumpsToEnd) {
            fixup(jumpLoc, URX_JMP, fCompiledPat.size());
        }
    }

    /**
     * The required repetitions are laid out one after another, followed by either a star
     * loop or the optional repetitions.
     */
    private void compileLoop(final RegexNode node) {
        RegexNode body = node.child(0);
        int copies = node.max == RegexNode.INFINITE ? node.min : node.max;
        for (int i = 0; i < node.min; i++) {
            int bodyStart = fCompiledPat.size();
            compileNode(body);
            if (i == 0) {
                checkRepeatSize(bodyStart, copies - 1);
            }
        }
        if (node.max == RegexNode.INFINITE) {
            compileStar(body, node.lazy);
            return;
        }
        int optional = node.max - node.min;
        if (optional == 0) {
            return;
        }
        if (!node.lazy) {
            //   STATE_SAVE end
            //   ...body
            //   STATE_SAVE end
            //   ...body
            // end:
            List<Integer> saves = new ArrayList<>();
            for (int i = 0; i < optional; i++) {
                int copyStart = fCompiledPat.size();
                saves.add(appendOp(URX_STATE_SAVE, 0));
                compileNode(body);
                if (i == 0) {
                    checkRepeatSize(copyStart, optional - 1);
                }
            }
            for (int saveLoc : saves) {
                fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
            }
        } else {
            //   STATE_SAVE take1
            //   JMP        end
            // take1:
            //   ...body
            //   STATE_SAVE take2
            //   JMP        end
            // take2:
            //   ...
            // end:
            List<Integer> jumpsToEnd = new ArrayList<>();
            for (int i = 0; i < optional; i++) {
                int saveLoc = appendOp(URX_STATE_SAVE, 0);
                jumpsToEnd.add(appendOp(URX_JMP, 0));
                fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
                compileNode(body);
                if (i == 0) {
                    checkRepeatSize(saveLoc, optional - 1);
                }
            }
            for (int jumpLoc : jumpsToEnd) {
                fixup(jumpLoc, URX_JMP, fCompiledPat.size());
            }
        }
    }

    /**
     * Greedy:
     * <pre>
     * top:
     *   STATE_SAVE  end
     *   STO_INP_LOC slot      only when the body can match an empty string
     *   ...body
     *   JMP         top       or JMPX top, slot
     * end:
     * </pre>
     * Lazy:
     * <pre>
     * top:
     *   STATE_SAVE  body
     *   JMP         end
     * body:
     *   STO_INP_LOC slot
     *   ...body
     *   JMP         top       or JMPX top, slot
     * end:
     * </pre>
     * JMPX only loops back when the iteration consumed input, and fails otherwise.
     */
    private void compileStar(final RegexNode body, final boolean lazy) {
        int topLoc = fCompiledPat.size();
        int saveLoc = appendOp(URX_STATE_SAVE, 0);
        int exitJumpLoc = -1;
        if (lazy) {
            exitJumpLoc = appendOp(URX_JMP, 0);
            fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
        }

        boolean guarded = body.minLength() == 0;
        int slot = -1;
        if (guarded) {
            slot = fFrameExtras++;
            checkOperand(slot);
            appendOp(URX_STO_INP_LOC, slot);
        }
        compileNode(body);
        if (guarded) {
            appendOp(URX_JMPX, topLoc);
            appendOp(URX_RESERVED_OP, slot);
        } else {
            appendOp(URX_JMP, topLoc);
        }

        if (lazy) {
            fixup(exitJumpLoc, URX_JMP, fCompiledPat.size());
        } else {
            fixup(saveLoc, URX_STATE_SAVE, fCompiledPat.size());
        }
    }

    /**
     * Fails before unrolling when {@code remainingCopies} more copies of the code emitted
     * since {@code copyStart} would not fit.
     */
    private void checkRepeatSize(final int copyStart, final int remainingCopies) {
        long copySize = fCompiledPat.size() - copyStart;
        if (fCompiledPat.size() + copySize * remainingCopies > URX_MAX_VALUE) {
            throw new UErrorException(U_REGEX_PATTERN_TOO_BIG);
        }
    }

    private int allocateData(final int size) {
        int loc = fDataSize;
        fDataSize += size;
        checkOperand(fDataSize);
        return loc;
    }

    /**
     * @return the location of the new op
     */
    private int appendOp(final UrxOps type, final int value) {
        checkOperand(value);
        int loc = fCompiledPat.size();
        checkOperand(loc + 1);
        fCompiledPat.addElement(URX_BUILD(type, value));
        return loc;
    }

    private void fixup(final int loc, final UrxOps type, final int value) {
        assert URX_TYPE(fCompiledPat.elementAti(loc)) == type;
        checkOperand(value);
        fCompiledPat.setElementAt(URX_BUILD(type, value), loc);
    }

    private static void checkOperand(final int value) {
        if (value < 0 || value > URX_MAX_VALUE) {
            throw new UErrorException(U_REGEX_PATTERN_TOO_BIG);
        }
    }

    //------------------------------------------------------------------------------
    //
    //   Start of match hints
    //
    //------------------------------------------------------------------------------

    /**
     * Looks at what a match has to begin with, so that the scan can skip start
     * positions that can not work.
     */
    private void matchStartType(final RegexNode tree) {
        fRXPat.fStartType = StartOfMatch.START_NO_INFO;
        RegexNode first = leadingNode(tree);
        if (first == null) {
            return;
        }
        switch (first.type) {
            case ONE:
                if (!first.ignoreCase) {
                    fRXPat.fStartType = StartOfMatch.START_CHAR;
                    fRXPat.fInitialChar = first.ch;
                }
                break;
            case MULTI:
                if (!first.ignoreCase) {
                    fRXPat.fStartType = StartOfMatch.START_STRING;
                    fRXPat.fInitialString = first.str.clone();
                }
                break;
            case SET:
                if (!first.ignoreCase) {
                    fRXPat.fStartType = StartOfMatch.START_SET;
                    fRXPat.fInitialChars = first.set.isFrozen() ? first.set : first.set.cloneAsThawed().freeze();
                }
                break;
            case BEGINNING:
                fRXPat.fStartType = StartOfMatch.START_START;
                break;
            case BOL:
                fRXPat.fStartType = first.multiline ? StartOfMatch.START_LINE : StartOfMatch.START_START;
                break;
            default:
                break;
        }
    }

    /**
     * The node every match begins with, or null if there is no single one.
     */
    private static RegexNode leadingNode(final RegexNode node) {
        switch (node.type) {
            case CONCATENATE:
                return node.children.isEmpty() ? null : leadingNode(node.child(0));
            case GROUP:
            case ATOMIC:
                return leadingNode(node.child(0));
            case LOOP:
                return node.min > 0 ? leadingNode(node.child(0)) : null;
            case ONE:
            case MULTI:
            case SET:
            case BEGINNING:
            case BOL:
                return node;
            default:
                return null;
        }
    }
}
