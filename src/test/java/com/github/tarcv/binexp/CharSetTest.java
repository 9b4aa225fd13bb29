package com.github.tarcv.binexp;

import com.ibm.icu.lang.UCharacter;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import static com.github.tarcv.binexp.UErrorCode.U_REGEX_UNIMPLEMENTED;
import static com.github.tarcv.binexp.URegexpFlag.UREGEX_ECMASCRIPT;

public class CharSetTest {

    private static CharSet set(final int... bounds) {
        CharSet result = new CharSet();
        for (int i = 0; i < bounds.length; i += 2) {
            result.addRange(bounds[i], bounds[i + 1]);
        }
        return result;
    }

    private static String rangesOf(final CharSet set) {
        StringBuilder sb = new StringBuilder();
        for (CharSet.SingleRange r : set.ranges()) {
            sb.append(r);
        }
        return sb.toString();
    }

    private static void assertCanonical(final CharSet set) {
        List<CharSet.SingleRange> ranges = set.ranges();
        for (int i = 0; i < ranges.size(); i++) {
            Assert.assertTrue(ranges.get(i).first <= ranges.get(i).last);
            if (i > 0) {
                Assert.assertTrue("touching or out of order: " + set,
                        (long) ranges.get(i - 1).last + 1 < ranges.get(i).first);
            }
        }
    }

    @Test
    public void Canonicalize() {
        CharSet s = set('m', 'p', 'a', 'c', 'd', 'f', 'o', 't', 'x', 'x');
        Assert.assertEquals("[0061..0066][006D..0074][0078..0078]", rangesOf(s));

        s.canonicalize();
        Assert.assertEquals("[0061..0066][006D..0074][0078..0078]", rangesOf(s));

        CharSet top = set(0x10FFF0, 0x10FFFF, 0x10FFFE, 0x10FFFF, 0x10FFF0, 0x10FFF3, 0, 0);
        Assert.assertEquals("[0000..0000][10FFF0..10FFFF]", rangesOf(top));
    }

    @Test
    public void CanonicalizeAgreesWithRanges() {
        Random random = new Random(20240131);
        for (int round = 0; round < 300; round++) {
            int count = 1 + random.nextInt(8);
            int[][] bounds = new int[count][];
            CharSet s = new CharSet();
            for (int i = 0; i < count; i++) {
                int first = random.nextInt(200);
                int last = first + random.nextInt(20);
                bounds[i] = new int[]{first, last};
                s.addRange(first, last);
            }
            assertCanonical(s);

            String once = rangesOf(s);
            s.canonicalize();
            Assert.assertEquals(once, rangesOf(s));

            for (int ch = 0; ch < 230; ch++) {
                boolean expected = false;
                for (int[] b : bounds) {
                    expected |= b[0] <= ch && ch <= b[1];
                }
                Assert.assertEquals("U+" + Integer.toHexString(ch) + " in " + s, expected, s.charIn(ch));
            }
        }
    }

    @Test
    public void NegationInvertsRangesAndCategories() {
        CharSet plain = set('0', '9', 'a', 'f');
        plain.addCategory("Lu", false, false, "");
        CharSet negated = plain.cloneAsThawed();
        negated.setNegated(true);

        for (int ch = 0; ch < 0x300; ch++) {
            Assert.assertEquals(!plain.charIn(ch), negated.charIn(ch));
        }
        Assert.assertFalse(negated.charIn('Q'));
        Assert.assertTrue(negated.charIn('q'));
        Assert.assertNotEquals(plain, negated);
    }

    @Test
    public void NegatedCategory() {
        CharSet notUpper = new CharSet().addCategory("Lu", true, false, "");
        Assert.assertFalse(notUpper.charIn('A'));
        Assert.assertTrue(notUpper.charIn('a'));
        Assert.assertTrue(notUpper.charIn('1'));
        Assert.assertEquals("[\\P{Lu}]", notUpper.toString());

        // categories are a union, a negated one does not exclude the others
        CharSet mixed = new CharSet()
                .addCategory("L", true, false, "")
                .addCategory("Lu", false, false, "");
        Assert.assertTrue(mixed.charIn('A'));
        Assert.assertFalse(mixed.charIn('a'));
        Assert.assertTrue(mixed.charIn('1'));

        CharSet notSpaceOrSpace = new CharSet();
        notSpaceOrSpace.addSpace(false, true);
        notSpaceOrSpace.addSpace(false, false);
        Assert.assertTrue(notSpaceOrSpace.charIn(' '));
        Assert.assertTrue(notSpaceOrSpace.charIn('x'));
    }

    @Test
    public void Subtraction() {
        CharSet vowels = set('a', 'a', 'e', 'e', 'i', 'i', 'o', 'o', 'u', 'u');
        CharSet consonants = set('a', 'z').addSubtraction(vowels);
        Assert.assertTrue(consonants.hasSubtraction());
        Assert.assertFalse(consonants.isMergeable());

        for (int ch = 0; ch < 0x80; ch++) {
            boolean base = ch >= 'a' && ch <= 'z';
            Assert.assertEquals(base && !vowels.charIn(ch), consonants.charIn(ch));
        }
        Assert.assertEquals("[a-z-[aeiou]]", consonants.toString());
    }

    @Test
    public void NestedSubtraction() {
        // [a-z-[aeiou-[u]]]
        CharSet inner = set('a', 'a', 'e', 'e', 'i', 'i', 'o', 'o', 'u', 'u').addSubtraction(set('u', 'u'));
        CharSet outer = set('a', 'z').addSubtraction(inner);

        Assert.assertFalse(outer.charIn('a'));
        Assert.assertFalse(outer.charIn('o'));
        Assert.assertTrue(outer.charIn('u'));
        Assert.assertTrue(outer.charIn('b'));
        Assert.assertFalse(outer.charIn('A'));

        // a negated subtrahend keeps only what it excludes: [a-z-[^aeiou]]
        CharSet notVowels = set('a', 'a', 'e', 'e', 'i', 'i', 'o', 'o', 'u', 'u');
        notVowels.setNegated(true);
        CharSet onlyVowels = set('a', 'z').addSubtraction(notVowels);
        Assert.assertTrue(onlyVowels.charIn('e'));
        Assert.assertFalse(onlyVowels.charIn('b'));

        Assert.assertThrows(IllegalArgumentException.class, () -> outer.addSubtraction(outer));
    }

    @Test
    public void SubtractionInPatterns() {
        RegexPattern consonant = RegexPattern.compile("[a-z-[aeiou]]+");
        Match m = consonant.findStringMatchStartingAt("queue strength", 0);
        Assert.assertEquals(0, m.getIndex());
        Assert.assertEquals(1, m.getLength());
        m = consonant.findNextMatch(m);
        Assert.assertEquals("str", m.getValue());

        Assert.assertTrue(RegexPattern.matches("[a-z-[aeiou-[u]]]*", "bu"));
        Assert.assertFalse(RegexPattern.matches("[a-z-[aeiou-[u]]]*", "ba"));
    }

    @Test
    public void Categories() {
        CharSet upper = new CharSet().addCategory("Lu", false, false, "");
        Assert.assertTrue(upper.charIn('A'));
        Assert.assertTrue(upper.charIn(0x0410));
        Assert.assertFalse(upper.charIn('a'));

        CharSet letters = new CharSet().addCategory("L", false, false, "");
        Assert.assertTrue(letters.charIn('a'));
        Assert.assertTrue(letters.charIn(0x4e00));
        Assert.assertFalse(letters.charIn('1'));

        CharSet space = new CharSet();
        space.addSpace(false, false);
        Assert.assertTrue(space.charIn(' '));
        Assert.assertTrue(space.charIn(0x2003));
        Assert.assertTrue(space.charIn('\n'));
        Assert.assertFalse(space.charIn('x'));

        CharSet word = new CharSet();
        word.addWord(false, false);
        Assert.assertTrue(word.charIn('_'));
        Assert.assertTrue(word.charIn(0x0301));
        Assert.assertTrue(word.charIn(0x0663));
        Assert.assertFalse(word.charIn('-'));
    }

    @Test
    public void CaseInsensitiveCaseCategories() {
        CharSet upper = new CharSet().addCategory("Lu", false, true, "");
        Assert.assertTrue(upper.charIn('A'));
        Assert.assertTrue(upper.charIn('a'));
        Assert.assertTrue(upper.charIn(0x01C5));
        Assert.assertFalse(upper.charIn('1'));

        Assert.assertEquals(upper, new CharSet().addCategory("Lt", false, true, ""));

        CharSet other = new CharSet().addCategory("Lo", false, true, "");
        Assert.assertFalse(other.charIn('a'));
    }

    @Test
    public void AddLowercaseLatinCyrillicGreek() {
        CharSet latin = set('A', 'Z');
        latin.addLowercase();
        Assert.assertEquals("[0041..005A][0061..007A]", rangesOf(latin));

        CharSet cyrillic = set(0x0410, 0x042F);
        cyrillic.addLowercase();
        Assert.assertEquals("[0410..044F]", rangesOf(cyrillic));

        CharSet georgian = set(0x10A0, 0x10C5);
        georgian.addLowercase();
        Assert.assertEquals("[10A0..10C5][2D00..2D25]", rangesOf(georgian));

        CharSet cherokee = set(0x13A0, 0x13F5);
        cherokee.addLowercase();
        Assert.assertEquals("[13A0..13F5][13F8..13FD][AB70..ABBF]", rangesOf(cherokee));

        CharSet greek = set(0x0391, 0x03A9);
        greek.addLowercase();
        Assert.assertEquals("[0391..03A9][03B1..03C1][03C3..03C9]", rangesOf(greek));

        CharSet latin1 = set(0x00C0, 0x00DE);
        latin1.addLowercase();
        Assert.assertEquals("[00C0..00DE][00E0..00F6][00F8..00FE]", rangesOf(latin1));

        // lowercase already inside the range
        CharSet extended = set(0x0100, 0x0105);
        extended.addLowercase();
        Assert.assertEquals("[0100..0105]", rangesOf(extended));

        // spans several table entries
        CharSet wide = set(0x0041, 0x0100);
        wide.addLowercase();
        Assert.assertEquals("[0041..0101]", rangesOf(wide));
    }

    @Test
    public void AddLowercaseKeepsOriginalsAndAddsOnlyLowercase() {
        int[][] ranges = {{'A', 'Z'}, {0x0410, 0x042F}, {0x0391, 0x03A9}, {0x0531, 0x0556}, {0x0139, 0x0148}, {0xFF21, 0xFF3A},
                {0x10A0, 0x10C5}, {0x13A0, 0x13F5}};
        for (int[] r : ranges) {
            CharSet original = set(r[0], r[1]);
            CharSet folded = original.cloneAsThawed();
            folded.addLowercase();
            for (int ch = r[0]; ch <= r[1]; ch++) {
                Assert.assertTrue(folded.charIn(ch));
                Assert.assertTrue(folded.charIn(UCharacter.toLowerCase(ch)));
            }
            for (int ch = 0; ch < 0x10000; ch++) {
                if (folded.charIn(ch) && !original.charIn(ch)) {
                    Assert.assertTrue("U+" + Integer.toHexString(ch) + " added for " + original,
                            UCharacter.isLowerCase(ch));
                }
            }
        }
    }

    @Test
    public void AddLowercaseReplacesSingletons() {
        CharSet q = set('Q', 'Q', '0', '9');
        q.addLowercase();
        Assert.assertTrue(q.charIn('q'));
        Assert.assertFalse(q.charIn('Q'));
        Assert.assertTrue(q.charIn('5'));

        CharSet dottedI = set(0x0130, 0x0130);
        dottedI.addLowercase();
        Assert.assertTrue(dottedI.isSingleton());
        Assert.assertEquals('i', dottedI.singletonChar());
    }

    @Test
    public void Singletons() {
        CharSet x = set('x', 'x');
        Assert.assertTrue(x.isSingleton());
        Assert.assertFalse(x.isSingletonInverse());
        Assert.assertEquals('x', x.singletonChar());

        CharSet notX = x.cloneAsThawed();
        notX.setNegated(true);
        Assert.assertFalse(notX.isSingleton());
        Assert.assertTrue(notX.isSingletonInverse());
        Assert.assertEquals('x', notX.singletonChar());

        Assert.assertFalse(set('x', 'y').isSingleton());
        Assert.assertFalse(set('x', 'x').addCategory("Nd", false, false, "").isSingleton());
        Assert.assertFalse(set('x', 'x').addSubtraction(set('y', 'y')).isSingleton());
        Assert.assertFalse(new CharSet().isSingleton());

        Assert.assertThrows(AssertionError.class, () -> set('a', 'b').singletonChar());
    }

    @Test
    public void EqualityIsStructural() {
        CharSet a = set('a', 'c', 'x', 'z', 'd', 'f');
        CharSet b = set('x', 'z', 'a', 'f');
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());

        a.addCategory("Nd", false, false, "");
        Assert.assertNotEquals(a, b);
        b.addCategory("Nd", false, false, "");
        Assert.assertEquals(a, b);

        CharSet c = b.cloneAsThawed().addCategory("Lu", true, false, "");
        CharSet d = b.cloneAsThawed().addCategory("Lu", false, false, "");
        Assert.assertNotEquals(c, d);

        CharSet e = a.cloneAsThawed().addSubtraction(set('b', 'b'));
        Assert.assertNotEquals(a, e);
        Assert.assertEquals(e, b.cloneAsThawed().addSubtraction(set('b', 'b')));
        Assert.assertEquals(e.hashCode(), b.cloneAsThawed().addSubtraction(set('b', 'b')).hashCode());
    }

    @Test
    public void AddSet() {
        CharSet negated = set('0', '9');
        negated.setNegated(true);
        CharSet target = set('a', 'z').addSet(negated);
        Assert.assertFalse(target.isNegated());
        Assert.assertTrue(target.charIn('5'));
        Assert.assertTrue(target.charIn('q'));
        Assert.assertEquals("[0-9a-z]", target.toString());
    }

    @Test
    public void InvalidRange() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new CharSet().addRange('z', 'a'));
    }

    @Test
    public void ToStringDescribesTheSet() {
        CharSet s = set('a', 'z').addCategory("Lu", false, false, "").addSubtraction(set('a', 'a', 'e', 'e'));
        s.setNegated(true);
        Assert.assertEquals("[^a-z\\p{Lu}-[ae]]", s.toString());
        Assert.assertEquals("[\\n\\ \\x7F\\u0410\\x{01F600}]", set('\n', '\n', ' ', ' ', 0x7f, 0x7f, 0x410, 0x410, 0x1F600, 0x1F600).toString());
    }

    /**
     * In ECMAScript mode \D inside brackets adds the same ranges as \d, the negation
     * being dropped on the way. Outside brackets \D is the proper complement.
     */
    @Test
    public void EcmaDigitIgnoresNegation() {
        CharSet digit = new CharSet();
        digit.addDigit(true, false, "[\\d]");
        CharSet notDigit = new CharSet();
        notDigit.addDigit(true, true, "[\\D]");
        Assert.assertEquals(digit, notDigit);
        Assert.assertTrue(notDigit.charIn('5'));
        Assert.assertFalse(notDigit.charIn('x'));

        RegexPattern bracketed = RegexPattern.compile("[\\D]", EnumSet.of(UREGEX_ECMASCRIPT));
        Assert.assertNotNull(bracketed.findStringMatchStartingAt("x5", 0));
        Assert.assertEquals(1, bracketed.findStringMatchStartingAt("x5", 0).getIndex());

        RegexPattern bare = RegexPattern.compile("\\D", EnumSet.of(UREGEX_ECMASCRIPT));
        Assert.assertEquals(0, bare.findStringMatchStartingAt("x5", 0).getIndex());
    }

    @Test
    public void EcmaSpaceAndWordNegation() {
        CharSet notSpace = new CharSet();
        notSpace.addSpace(true, true);
        Assert.assertFalse(notSpace.charIn(' '));
        Assert.assertFalse(notSpace.charIn('\t'));
        Assert.assertTrue(notSpace.charIn('a'));
        // ECMAScript space is ASCII only
        Assert.assertTrue(notSpace.charIn(0x2003));

        CharSet notWord = new CharSet();
        notWord.addWord(true, true);
        Assert.assertFalse(notWord.charIn('a'));
        Assert.assertFalse(notWord.charIn('_'));
        Assert.assertFalse(notWord.charIn(0x0130));
        Assert.assertTrue(notWord.charIn('-'));
        Assert.assertTrue(notWord.charIn(0x00e9));
    }

    @Test
    public void UnsupportedPropertyFailsFast() {
        try {
            new CharSet().addCategory("Greek", false, false, "\\p{Greek}");
            Assert.fail("Expected an exception");
        } catch (UErrorException e) {
            Assert.assertEquals(U_REGEX_UNIMPLEMENTED, e.getErrorCode());
        }
    }

    @Test
    public void CustomPropertyResolver() {
        List<String> asked = new ArrayList<>();
        UnicodePropertyResolver greek = (name, negate, pattern) -> {
            asked.add(name);
            CharSet result = set(0x03B1, 0x03C9);
            if (negate) {
                CharSet inverted = new CharSet();
                inverted.addRanges(CharSet.invertRanges(result.ranges()));
                return inverted;
            }
            return result;
        };
        CharSet s = new CharSet().addCategory("IsGreek", false, false, "", greek);
        Assert.assertTrue(s.charIn(0x03B2));
        Assert.assertFalse(s.charIn('b'));

        CharSet n = new CharSet().addCategory("IsGreek", true, false, "", greek);
        Assert.assertFalse(n.charIn(0x03B2));
        Assert.assertTrue(n.charIn('b'));
        Assert.assertEquals(2, asked.size());

        Assert.assertThrows(IllegalStateException.class,
                () -> new CharSet().addCategory("Nothing", false, false, "", (name, negate, pattern) -> null));
    }

    @Test
    public void FrozenSetsAreImmutable() {
        CharSet digits = RegexStaticSets.INSTANCE.digitClass;
        Assert.assertTrue(digits.isFrozen());
        Assert.assertThrows(UnsupportedOperationException.class, () -> digits.addChar('x'));
        Assert.assertThrows(UnsupportedOperationException.class, () -> digits.addSubtraction(set('1', '1')));
        Assert.assertThrows(UnsupportedOperationException.class, digits::addLowercase);

        CharSet copy = digits.cloneAsThawed();
        Assert.assertFalse(copy.isFrozen());
        Assert.assertEquals(digits, copy);
        copy.addChar('x');
        Assert.assertTrue(copy.charIn('x'));
        Assert.assertFalse(digits.charIn('x'));

        CharSet withSub = set('a', 'z').addSubtraction(set('q', 'q')).freeze();
        CharSet thawed = withSub.cloneAsThawed();
        thawed.addLowercase();
        Assert.assertFalse(thawed.charIn('q'));
    }

    @Test
    public void StaticClasses() {
        RegexStaticSets sets = RegexStaticSets.INSTANCE;
        Assert.assertTrue(sets.anyClass.charIn(0));
        Assert.assertTrue(sets.anyClass.charIn(0x10FFFF));
        Assert.assertFalse(sets.notNewLineClass.charIn('\n'));
        Assert.assertTrue(sets.notNewLineClass.charIn('\r'));
        Assert.assertTrue(sets.ecmaWordClass.charIn(0x0130));
        Assert.assertFalse(sets.ecmaWordClass.charIn(0x0131));
        Assert.assertTrue(sets.ecmaSpaceClass.charIn(0x0b));
        Assert.assertFalse(sets.notEcmaSpaceClass.charIn(' '));
        Assert.assertTrue(sets.digitClass.charIn(0x0663));
        Assert.assertFalse(sets.ecmaDigitClass.charIn(0x0663));
        Assert.assertFalse(sets.notWordClass.charIn('k'));
    }
}
