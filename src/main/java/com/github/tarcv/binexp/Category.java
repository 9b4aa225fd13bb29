package com.github.tarcv.binexp;

import com.ibm.icu.lang.UCharacter;

import java.util.Objects;

/**
 * One general-category test inside a {@link CharSet}, with its own negation flag.
 * The category negation and the set negation are independent and both apply.
 */
final class Category {
    enum Kind {
        /** Synthetic \s category, Unicode White_Space. */
        SPACE,
        /** Synthetic \w category. */
        WORD,
        /** A general category or category group, such as Lu or L. */
        UNICODE,
        /** A name that is neither of the above and must go through a property resolver. */
        UNRESOLVED
    }

    static final String SPACE_CATEGORY_TEXT = " ";
    static final String WORD_CATEGORY_TEXT = "W";

    final Kind kind;
    final String name;
    final boolean negate;
    private final long mask;

    private Category(final Kind kind, final String name, final boolean negate, final long mask) {
        this.kind = kind;
        this.name = name;
        this.negate = negate;
        this.mask = mask;
    }

    static Category of(final String name, final boolean negate) {
        if (SPACE_CATEGORY_TEXT.equals(name)) {
            return new Category(Kind.SPACE, name, negate, 0);
        }
        if (WORD_CATEGORY_TEXT.equals(name)) {
            return new Category(Kind.WORD, name, negate, UChar.GC_WORD_MASK);
        }
        long mask = UChar.categoryMask(name);
        if (mask != 0) {
            return new Category(Kind.UNICODE, name, negate, mask);
        }
        return new Category(Kind.UNRESOLVED, name, negate, 0);
    }

    static Category space(final boolean negate) {
        return of(SPACE_CATEGORY_TEXT, negate);
    }

    static Category word(final boolean negate) {
        return of(WORD_CATEGORY_TEXT, negate);
    }

    /**
     * Raw membership, ignoring {@link #negate}.
     */
    boolean contains(final int ch) {
        switch (kind) {
            case SPACE:
                return ch >= 0 && ch <= Character.MAX_CODE_POINT && UCharacter.isUWhiteSpace(ch);
            case WORD:
            case UNICODE:
                return UChar.isInCategory(ch, mask);
            case UNRESOLVED:
                throw new UErrorException(UErrorCode.U_REGEX_UNIMPLEMENTED,
                        "Unresolved property in a character class: " + name);
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Category)) return false;
        Category that = (Category) o;
        return negate == that.negate && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, negate);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SPACE:
                return negate ? "\\S" : "\\s";
            case WORD:
                return negate ? "\\W" : "\\w";
            case UNICODE:
                return (negate ? "\\P{" : "\\p{") + name + "}";
            default:
                return "Unknown category: " + name;
        }
    }
}
