package com.github.tarcv.binexp;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;

import static com.github.tarcv.binexp.URegexpFlag.UREGEX_CASE_INSENSITIVE;
import static com.github.tarcv.binexp.URegexpFlag.UREGEX_RAW_BYTES;

/**
 * Scanning of binary data: code point and raw byte symbols, resumable scans and offset bounds.
 */
public class BinaryMatchTest {
    private static final Logger LOGGER = Logger.getLogger(BinaryMatchTest.class.getName());

    /** Not valid UTF-8: 0xff never occurs in UTF-8, 0xef and 0xcd are lead bytes without continuation. */
    private static final byte[] OPCODES = bytes(0x65, 0xff, 0x15, 0xef, 0x65, 0x15, 0xcd, 0x50, 0x65, 0xff, 0x15, 0x25);

    private static final byte[] CA_DATA = bytes(0x65, 0xca, 0x05, 0xf4, 0x65, 0xca, 0xaf, 0xca, 0x65, 0xff, 0x15, 0x25);

    /** "\xca[\x00-\xff]{2}" with the escapes already turned into bytes. */
    private static final byte[] CA_PATTERN = bytes(0xca, '[', 0x00, '-', 0xff, ']', '{', '2', '}');

    private static byte[] bytes(final int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    private static void assertMatch(final int expectedIndex, final int expectedLength, final Match actual) {
        Assert.assertNotNull("Expected a match at " + expectedIndex, actual);
        Assert.assertEquals("index", expectedIndex, actual.getIndex());
        Assert.assertEquals("length", expectedLength, actual.getLength());
    }

    @Test
    public void BinaryMatchBasic() {
        RegexPattern opcode = RegexPattern.compile(bytes(0x65, 0xff, 0x15));

        assertMatch(0, 3, opcode.findStringMatchStartingAt(OPCODES, 0));
        assertMatch(8, 3, opcode.findStringMatchStartingAt(OPCODES, 1));
        assertMatch(8, 3, opcode.findStringMatchStartingAt(OPCODES, 8));
        Assert.assertNull(opcode.findStringMatchStartingAt(OPCODES, 9));
    }

    @Test
    public void MalformedUnitsAreSymbols() {
        // every malformed unit decodes to one U+FFFD and still takes one position
        SymbolText text = SymbolText.ofUtf8(OPCODES);
        Assert.assertEquals(12, text.length());
        Assert.assertEquals(0xfffd, text.symbolAt(1));
        Assert.assertEquals(0xfffd, text.symbolAt(3));
        Assert.assertEquals(0x65, text.symbolAt(4));
        Assert.assertEquals(0xfffd, text.symbolAt(6));
        Assert.assertEquals(0x50, text.symbolAt(7));

        RegexPattern anything = RegexPattern.compile("\\ufffd.");
        List<Integer> starts = new ArrayList<>();
        for (Match m = anything.findStringMatchStartingAt(OPCODES, 0); m != null; m = anything.findNextMatch(m)) {
            starts.add(m.getIndex());
        }
        Assert.assertEquals(Arrays.asList(1, 3, 6, 9), starts);
    }

    @Test
    public void DefaultModeDecodesPatternBytes() {
        RegexPattern opcode = RegexPattern.compile(CA_PATTERN);
        Assert.assertFalse(opcode.isRawBytes());

        // 0xca starts a two byte sequence that 0x5b does not continue, so the pattern
        // begins with U+FFFD, and so do the malformed units of the decoded input
        assertMatch(1, 3, opcode.findStringMatchStartingAt(CA_DATA, 1));
        // no byte is U+FFFD
        Assert.assertNull(opcode.findBytesMatchStartingAt(CA_DATA, 1));
    }

    @Test
    public void ByteMatchSuccess() {
        RegexPattern opcode = RegexPattern.compile(CA_PATTERN, EnumSet.of(UREGEX_RAW_BYTES));
        Assert.assertTrue(opcode.isRawBytes());

        Assert.assertNull(opcode.findStringMatchStartingAt(CA_DATA, 1));

        assertMatch(1, 3, opcode.findBytesMatchStartingAt(CA_DATA, 1));
        assertMatch(5, 3, opcode.findBytesMatchStartingAt(CA_DATA, 2));
        assertMatch(5, 3, opcode.findBytesMatchStartingAt(CA_DATA, 5));
        assertMatch(7, 3, opcode.findBytesMatchStartingAt(CA_DATA, 6));
        Assert.assertNull(opcode.findBytesMatchStartingAt(CA_DATA, 8));
    }

    @Test
    public void EscapedPatternDependsOnInputMode() {
        // Escapes name symbol values, so the same text pattern finds the bytes only
        // when the input is scanned byte by byte.
        RegexPattern opcode = RegexPattern.compile("\\xca[\\x00-\\xff]{2}");

        Assert.assertNull(opcode.findStringMatchStartingAt(CA_DATA, 1));
        assertMatch(1, 3, opcode.findBytesMatchStartingAt(CA_DATA, 1));

        // and the other way round: a two byte sequence is a single code point
        RegexPattern modifierLetter = RegexPattern.compile("\\u02af");
        assertMatch(5, 1, modifierLetter.findStringMatchStartingAt(CA_DATA, 0));
        Assert.assertNull(modifierLetter.findBytesMatchStartingAt(CA_DATA, 0));
    }

    @Test
    public void FindNextMatch() {
        RegexPattern opcode = RegexPattern.compile(CA_PATTERN, EnumSet.of(UREGEX_RAW_BYTES));

        List<Integer> starts = new ArrayList<>();
        for (Match m = opcode.findBytesMatchStartingAt(CA_DATA, 0); m != null; m = opcode.findNextMatch(m)) {
            final Match found = m;
            LOGGER.fine(() -> "non-overlapping " + found);
            starts.add(found.getIndex());
        }
        Assert.assertEquals(Arrays.asList(1, 5), starts);
    }

    @Test
    public void FindNextOverlappingMatch() {
        RegexPattern opcode = RegexPattern.compile(CA_PATTERN, EnumSet.of(UREGEX_RAW_BYTES));

        List<Integer> starts = new ArrayList<>();
        for (Match m = opcode.findBytesMatchStartingAt(CA_DATA, 0); m != null; m = opcode.findNextOverlappingMatch(m)) {
            final Match found = m;
            LOGGER.fine(() -> "overlapping " + found);
            starts.add(found.getIndex());
        }
        Assert.assertEquals(Arrays.asList(1, 5, 7), starts);
    }

    @Test
    public void OverlappingStringMatches() {
        RegexPattern aa = RegexPattern.compile("aa");
        Match m = aa.findStringMatchStartingAt("aaaa", 0);
        assertMatch(0, 2, m);
        assertMatch(2, 2, aa.findNextMatch(m));
        Assert.assertNull(aa.findNextMatch(aa.findNextMatch(m)));

        Match o = aa.findNextOverlappingMatch(m);
        assertMatch(1, 2, o);
        o = aa.findNextOverlappingMatch(o);
        assertMatch(2, 2, o);
        Assert.assertNull(aa.findNextOverlappingMatch(o));
    }

    @Test
    public void EmptyMatchesMoveForward() {
        RegexPattern optional = RegexPattern.compile("x*");
        String input = "axxb";

        List<String> found = new ArrayList<>();
        for (Match m = optional.findStringMatchStartingAt(input, 0); m != null; m = optional.findNextMatch(m)) {
            found.add(m.getIndex() + ":" + m.getLength());
        }
        // a match starting at the end of input is never reported
        Assert.assertEquals(Arrays.asList("0:0", "1:2", "3:0"), found);

        found.clear();
        for (Match m = optional.findStringMatchStartingAt(input, 0); m != null; m = optional.findNextOverlappingMatch(m)) {
            found.add(m.getIndex() + ":" + m.getLength());
        }
        Assert.assertEquals(Arrays.asList("0:0", "1:2", "2:1", "3:0"), found);
    }

    @Test
    public void OffsetAtEndIsNoMatch() {
        String[] patterns = {"", "a", "x*", "$", "\\z", "(?=)", "[^a]*"};
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);
        for (String p : patterns) {
            RegexPattern pattern = RegexPattern.compile(p);
            Assert.assertNull(p, pattern.findStringMatchStartingAt("abc", 3));
            Assert.assertNull(p, pattern.findStringMatchStartingAt(data, 3));
            Assert.assertNull(p, pattern.findBytesMatchStartingAt(data, 3));
        }
    }

    @Test
    public void EmptyInputIsNoMatch() {
        for (String p : new String[]{"", "a*", "^$", "\\A", "[\\x00-\\xff]"}) {
            RegexPattern pattern = RegexPattern.compile(p);
            Assert.assertNull(p, pattern.findStringMatchStartingAt("", 0));
            Assert.assertNull(p, pattern.findBytesMatchStartingAt(new byte[0], 0));
        }
    }

    @Test
    public void LastValidOffset() {
        RegexPattern any = RegexPattern.compile(".");
        assertMatch(2, 1, any.findStringMatchStartingAt("abc", 2));
        assertMatch(11, 1, RegexPattern.compile("%").findBytesMatchStartingAt(OPCODES, 11));
    }

    @Test
    public void InvalidOffsets() {
        RegexPattern pattern = RegexPattern.compile("a");
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> pattern.findStringMatchStartingAt("abc", -1));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> pattern.findStringMatchStartingAt("abc", 4));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> pattern.findBytesMatchStartingAt(OPCODES, -1));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> pattern.findBytesMatchStartingAt(OPCODES, 13));
        // offsets count code points, not UTF-8 bytes
        byte[] twoSymbols = "\u00e9\u00e9".getBytes(StandardCharsets.UTF_8);
        Assert.assertNull(pattern.findStringMatchStartingAt(twoSymbols, 2));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> pattern.findStringMatchStartingAt(twoSymbols, 3));
        Assert.assertNull(pattern.findBytesMatchStartingAt(twoSymbols, 4));

        // the pattern is still usable
        assertMatch(0, 1, pattern.findStringMatchStartingAt("abc", 0));
    }

    @Test
    public void OffsetsCountSupplementaryCodePointsOnce() {
        RegexPattern b = RegexPattern.compile("b");
        assertMatch(2, 1, b.findStringMatchStartingAt("\uD83D\uDE00ab", 0));
        byte[] utf8 = "\uD83D\uDE00ab".getBytes(StandardCharsets.UTF_8);
        assertMatch(2, 1, b.findStringMatchStartingAt(utf8, 0));
        assertMatch(5, 1, b.findBytesMatchStartingAt(utf8, 0));
    }

    @Test
    public void MatchValue() {
        RegexPattern opcode = RegexPattern.compile(CA_PATTERN, EnumSet.of(UREGEX_RAW_BYTES));
        Match m = opcode.findBytesMatchStartingAt(CA_DATA, 0);
        Assert.assertEquals("\u00ca\u0005\u00f4", m.getValue());
        Assert.assertEquals(4, m.getEnd());
    }

    @Test
    public void ResumeWithForeignMatch() {
        RegexPattern a = RegexPattern.compile("a");
        RegexPattern b = RegexPattern.compile("a");
        Match m = a.findStringMatchStartingAt("aaa", 0);
        Assert.assertThrows(IllegalArgumentException.class, () -> b.findNextMatch(m));
    }

    @Test
    public void RawBytePatternFlags() {
        RegexPattern pattern = RegexPattern.compile(bytes(0xc0, 0xff), EnumSet.of(UREGEX_RAW_BYTES, UREGEX_CASE_INSENSITIVE));
        Assert.assertEquals(EnumSet.of(UREGEX_RAW_BYTES, UREGEX_CASE_INSENSITIVE), pattern.flagSet());
        // case-insensitive byte matching uses the Latin-1 lowercase mapping
        assertMatch(1, 2, pattern.findBytesMatchStartingAt(bytes(0x00, 0xe0, 0xff), 0));
        Assert.assertEquals(Collections.emptySet(), RegexPattern.compile("a").flagSet());
    }
}
