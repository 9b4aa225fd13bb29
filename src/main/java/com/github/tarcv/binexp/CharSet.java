package com.github.tarcv.binexp;

import com.ibm.icu.impl.Utility;
import com.ibm.icu.lang.UCharacter;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A character class: sorted code point ranges, general categories, a negation
 * flag for the whole set and an optional subtracted set.
 * <p>
 * A code point is in the set if it is in one of the ranges or categories, the
 * result then being inverted when the set is negated, and it is not in the
 * subtracted set. Subtraction nests to any depth.
 * <p>
 * The range list is kept canonical after every mutation: sorted, with no two
 * ranges overlapping or touching. Equality and hashing are defined over the
 * canonical form, so equal classes can be shared by a compiled pattern.
 * <p>
 * Sets handed to a compiled pattern are frozen and can then be used from any
 * number of threads. Mutating a frozen set throws
 * {@link UnsupportedOperationException}.
 */
public final class CharSet {
    static final class SingleRange {
        final int first;
        final int last;

        SingleRange(final int first, final int last) {
            this.first = first;
            this.last = last;
        }

        boolean contains(final int ch) {
            return first <= ch && ch <= last;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof SingleRange)) return false;
            SingleRange that = (SingleRange) o;
            return first == that.first && last == that.last;
        }

        @Override
        public int hashCode() {
            return 31 * first + last;
        }

        @Override
        public String toString() {
            return "[" + Utility.hex(first, 4) + ".." + Utility.hex(last, 4) + "]";
        }
    }

    private static final Comparator<SingleRange> BY_FIRST = Comparator.comparingInt(r -> r.first);

    private boolean negate;
    private final List<SingleRange> ranges;
    private final List<Category> categories;
    private CharSet sub;
    private volatile boolean frozen;

    public CharSet() {
        ranges = new ArrayList<>();
        categories = new ArrayList<>();
    }

    private CharSet(final CharSet other) {
        negate = other.negate;
        ranges = new ArrayList<>(other.ranges);
        categories = new ArrayList<>(other.categories);
        sub = other.sub != null ? new CharSet(other.sub) : null;
    }

    /**
     * Builds a set from the old .NET class string format: every pair of characters
     * is the start and the exclusive end of a range, an unpaired final character
     * starts a range reaching the end of the code space.
     */
    static CharSet fromRangeString(final String setText, final boolean negate) {
        CharSet c = new CharSet();
        c.negate = negate;
        int[] chars = setText.codePoints().toArray();
        for (int i = 0; i < chars.length; i += 2) {
            int last = i + 1 < chars.length ? chars[i + 1] - 1 : Character.MAX_CODE_POINT;
            c.ranges.add(new SingleRange(chars[i], last));
        }
        c.canonicalize();
        return c;
    }

    static CharSet fromCategories(final boolean negate, final String... cats) {
        CharSet c = new CharSet();
        c.negate = negate;
        for (String cat : cats) {
            c.categories.add(Category.of(cat, false));
        }
        return c;
    }

    /**
     * Tests whether a code point, or a raw byte value in byte mode, is in this set.
     */
    public boolean charIn(final int ch) {
        boolean val = false;

        for (SingleRange r : ranges) {
            if (ch < r.first) {
                continue;
            }
            if (ch <= r.last) {
                val = true;
                break;
            }
        }

        if (!val) {
            for (Category ct : categories) {
                if (ct.contains(ch) != ct.negate) {
                    val = true;
                    break;
                }
            }
        }

        if (negate) {
            val = !val;
        }

        if (val && sub != null) {
            val = !sub.charIn(ch);
        }
        return val;
    }

    public CharSet addChar(final int ch) {
        return addRange(ch, ch);
    }

    public CharSet addRange(final int chMin, final int chMax) {
        checkFrozen();
        if (chMin > chMax) {
            throw new IllegalArgumentException("Invalid range " + Utility.hex(chMin, 4) + ".." + Utility.hex(chMax, 4));
        }
        ranges.add(new SingleRange(chMin, chMax));
        canonicalize();
        return this;
    }

    void addRanges(final Collection<SingleRange> newRanges) {
        checkFrozen();
        ranges.addAll(newRanges);
        canonicalize();
    }

    /**
     * Adds the ranges and categories of another set. Its negation and
     * subtraction are not carried over.
     */
    public CharSet addSet(final CharSet set) {
        checkFrozen();
        ranges.addAll(set.ranges);
        categories.addAll(set.categories);
        canonicalize();
        return this;
    }

    public CharSet addSubtraction(final CharSet subtracted) {
        checkFrozen();
        if (subtracted == this) {
            throw new IllegalArgumentException("A set can not subtract itself");
        }
        sub = subtracted;
        canonicalize();
        return this;
    }

    public CharSet addCategory(final String categoryName, final boolean negateCategory,
                               final boolean caseInsensitive, final String pattern) {
        return addCategory(categoryName, negateCategory, caseInsensitive, pattern, UnicodePropertyResolver.UNSUPPORTED);
    }

    /**
     * Adds a general category, or the ranges of a property resolved through {@code resolver}
     * when the name is not a general category.
     *
     * @throws UErrorException with {@link UErrorCode#U_REGEX_UNIMPLEMENTED} from the default resolver
     */
    public CharSet addCategory(final String categoryName, final boolean negateCategory,
                               final boolean caseInsensitive, final String pattern,
                               final UnicodePropertyResolver resolver) {
        checkFrozen();
        Category category = Category.of(categoryName, negateCategory);
        if (category.kind == Category.Kind.UNICODE) {
            if (caseInsensitive && isCaseCategory(categoryName)) {
                // any of the three case categories matches once one is asked for
                categories.add(Category.of("Ll", negateCategory));
                categories.add(Category.of("Lu", negateCategory));
                categories.add(Category.of("Lt", negateCategory));
            } else {
                categories.add(category);
            }
            canonicalize();
        } else {
            CharSet resolved = resolver.resolve(categoryName, negateCategory, pattern);
            if (resolved == null) {
                throw new IllegalStateException("Property resolver returned no set for " + categoryName);
            }
            addRanges(resolved.ranges);
        }
        return this;
    }

    private static boolean isCaseCategory(final String categoryName) {
        return "Ll".equals(categoryName) || "Lu".equals(categoryName) || "Lt".equals(categoryName);
    }

    void addDigit(final boolean ecma, final boolean negateDigit, final String pattern) {
        checkFrozen();
        if (ecma) {
            // Both branches add the same ranges: the negated ECMA class differs only in
            // its set-level flag, which is not carried over. Kept as it always behaved.
            if (negateDigit) {
                addRanges(RegexStaticSets.INSTANCE.notEcmaDigitClass.ranges);
            } else {
                addRanges(RegexStaticSets.INSTANCE.ecmaDigitClass.ranges);
            }
        } else {
            categories.add(Category.of("Nd", negateDigit));
        }
    }

    void addSpace(final boolean ecma, final boolean negateSpace) {
        checkFrozen();
        if (ecma) {
            addRanges(negateSpace
                    ? invertRanges(RegexStaticSets.INSTANCE.ecmaSpaceClass.ranges)
                    : RegexStaticSets.INSTANCE.ecmaSpaceClass.ranges);
        } else {
            categories.add(Category.space(negateSpace));
        }
    }

    void addWord(final boolean ecma, final boolean negateWord) {
        checkFrozen();
        if (ecma) {
            addRanges(negateWord
                    ? invertRanges(RegexStaticSets.INSTANCE.ecmaWordClass.ranges)
                    : RegexStaticSets.INSTANCE.ecmaWordClass.ranges);
        } else {
            categories.add(Category.word(negateWord));
        }
    }

    void setNegated(final boolean negated) {
        checkFrozen();
        negate = negated;
    }

    /**
     * Complement of a canonical range list within [0, MAX_CODE_POINT].
     */
    static List<SingleRange> invertRanges(final List<SingleRange> canonical) {
        List<SingleRange> result = new ArrayList<>();
        int next = Character.MIN_CODE_POINT;
        for (SingleRange r : canonical) {
            if (r.first > next) {
                result.add(new SingleRange(next, r.first - 1));
            }
            if (r.last >= Character.MAX_CODE_POINT) {
                return result;
            }
            next = r.last + 1;
        }
        result.add(new SingleRange(next, Character.MAX_CODE_POINT));
        return result;
    }

    /**
     * Reduces the range list to a unique, sorted form: overlapping or abutting
     * ranges are merged.
     */
    void canonicalize() {
        if (ranges.size() <= 1) {
            return;
        }
        ranges.sort(BY_FIRST);

        int i = 1;
        int j = 0;
        boolean done = false;
        for (; ; i++) {
            int last = ranges.get(j).last;
            for (; ; i++) {
                if (i == ranges.size() || last == Character.MAX_CODE_POINT) {
                    done = true;
                    break;
                }
                SingleRange currentRange = ranges.get(i);
                if (currentRange.first > last + 1) {
                    break;
                }
                if (last < currentRange.last) {
                    last = currentRange.last;
                }
            }

            ranges.set(j, new SingleRange(ranges.get(j).first, last));
            j++;

            if (done) {
                break;
            }
            if (j < i) {
                ranges.set(j, ranges.get(i));
            }
        }
        ranges.subList(j, ranges.size()).clear();
    }

    /**
     * Adds the lowercase versions of the characters already in the class, for
     * case-insensitive matching. A single character is replaced by its lowercase
     * form; a wider range keeps its original characters and gains the lowercase
     * ranges computed from {@link LowercaseMap}.
     */
    void addLowercase() {
        checkFrozen();
        List<SingleRange> original = new ArrayList<>(ranges);
        ranges.clear();
        for (SingleRange r : original) {
            if (r.first == r.last) {
                int lower = UCharacter.toLowerCase(r.first);
                ranges.add(new SingleRange(lower, lower));
            } else {
                ranges.add(r);
                addLowercaseRange(r.first, r.last, ranges);
            }
        }
        canonicalize();
        if (sub != null) {
            sub.addLowercase();
        }
    }

    /**
     * Computes a superset of L([chMin, chMax]) contained in the union of the
     * interval and its lowercase image, and adds the parts outside the interval.
     */
    static void addLowercaseRange(final int chMin, final int chMax, final List<SingleRange> dest) {
        for (int i = LowercaseMap.firstEntryReaching(chMin); i < LowercaseMap.TABLE.length; i++) {
            LowercaseMap lc = LowercaseMap.TABLE[i];
            if (lc.chMin > chMax) {
                break;
            }
            int chMinT = Math.max(lc.chMin, chMin);
            int chMaxT = Math.min(lc.chMax, chMax);

            chMinT = lc.op.apply(chMinT, lc.data);
            chMaxT = lc.op.apply(chMaxT, lc.data);

            if (chMinT < chMin || chMaxT > chMax) {
                dest.add(new SingleRange(chMinT, chMaxT));
            }
        }
    }

    /**
     * True if the set is exactly one character.
     */
    public boolean isSingleton() {
        return !negate && isSingleRangeOfOne();
    }

    /**
     * True if the set is every character except one.
     */
    public boolean isSingletonInverse() {
        return negate && isSingleRangeOfOne();
    }

    private boolean isSingleRangeOfOne() {
        return categories.isEmpty() && ranges.size() == 1
                && sub == null
                && ranges.get(0).first == ranges.get(0).last;
    }

    /**
     * The character of a singleton set.
     * Callers must check {@link #isSingleton()} or {@link #isSingletonInverse()} first;
     * the result is unspecified otherwise.
     */
    public int singletonChar() {
        assert isSingleton() || isSingletonInverse() : "not a singleton: " + this;
        return ranges.get(0).first;
    }

    public boolean isMergeable() {
        return !isNegated() && !hasSubtraction();
    }

    public boolean isNegated() {
        return negate;
    }

    public boolean hasSubtraction() {
        return sub != null;
    }

    List<SingleRange> ranges() {
        return Collections.unmodifiableList(ranges);
    }

    public CharSet freeze() {
        if (sub != null) {
            sub.freeze();
        }
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * A mutable deep copy.
     */
    public CharSet cloneAsThawed() {
        return new CharSet(this);
    }

    private void checkFrozen() {
        if (frozen) {
            throw new UnsupportedOperationException("Attempt to modify frozen object");
        }
    }

    /**
     * The canonical serialized form that equality and hashing are defined on.
     */
    byte[] mapHashFill() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        mapHashFill(buf);
        return buf.toByteArray();
    }

    private void mapHashFill(final ByteArrayOutputStream buf) {
        buf.write(negate ? 0 : 1);
        writeInt(buf, ranges.size());
        writeInt(buf, categories.size());
        for (SingleRange r : ranges) {
            writeInt(buf, r.first);
            writeInt(buf, r.last);
        }
        for (Category ct : categories) {
            byte[] name = ct.name.getBytes(StandardCharsets.UTF_8);
            writeInt(buf, name.length);
            buf.write(name, 0, name.length);
            buf.write(ct.negate ? 1 : 0);
        }
        if (sub != null) {
            buf.write(2);
            sub.mapHashFill(buf);
        }
    }

    private static void writeInt(final ByteArrayOutputStream buf, final int v) {
        buf.write(v);
        buf.write(v >>> 8);
        buf.write(v >>> 16);
        buf.write(v >>> 24);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof CharSet)) return false;
        return Arrays.equals(mapHashFill(), ((CharSet) o).mapHashFill());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(mapHashFill());
    }

    /**
     * A human-readable description, such as {@code [^a-z\p{Lu}-[aeiou]]}.
     */
    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[');
        if (isNegated()) {
            buf.append('^');
        }
        for (SingleRange r : ranges) {
            buf.append(charDescription(r.first));
            if (r.first != r.last) {
                buf.append('-');
                buf.append(charDescription(r.last));
            }
        }
        for (Category c : categories) {
            buf.append(c);
        }
        if (sub != null) {
            buf.append('-');
            buf.append(sub);
        }
        buf.append(']');
        return buf.toString();
    }

    /**
     * A human-readable description of a single character.
     */
    static String charDescription(final int ch) {
        if (ch == '\\') {
            return "\\\\";
        }
        if (ch > ' ' && ch <= '~') {
            return String.valueOf((char) ch);
        } else if (ch == '\n') {
            return "\\n";
        } else if (ch == ' ') {
            return "\\ ";
        }
        if (ch <= 0xff) {
            return "\\x" + Utility.hex(ch, 2);
        } else if (ch <= 0xffff) {
            return "\\u" + Utility.hex(ch, 4);
        }
        return "\\x{" + Utility.hex(ch, 6) + "}";
    }

    /**
     * Word characters for \b: letters, non-spacing marks, decimal digits,
     * connector punctuation and the zero width (non-)joiners.
     */
    static boolean isWordChar(final int ch) {
        return UChar.isInCategory(ch, UChar.GC_WORD_MASK) || ch == 0x200c || ch == 0x200d;
    }

    static boolean isEcmaWordChar(final int ch) {
        return RegexStaticSets.INSTANCE.ecmaWordClass.charIn(ch);
    }
}
