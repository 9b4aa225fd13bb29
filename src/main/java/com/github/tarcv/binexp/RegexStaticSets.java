package com.github.tarcv.binexp;

/**
 * Shared, frozen built-in character classes.
 */
enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;

    //
    //  Old .NET class strings: pairs of (first, one past last) characters.
    //
    static final String ECMA_WORD_SET_TEXT = "0:A[_`a{\u0130\u0131";
    static final String ECMA_SPACE_SET_TEXT = "\u0009\u000E !";
    static final String ECMA_DIGIT_SET_TEXT = "0:";

    /**
     * Every code point. In raw byte mode every byte value.
     */
    final CharSet anyClass;

    final CharSet ecmaWordClass;
    final CharSet notEcmaWordClass;
    final CharSet ecmaSpaceClass;
    final CharSet notEcmaSpaceClass;
    final CharSet ecmaDigitClass;
    final CharSet notEcmaDigitClass;

    final CharSet wordClass;
    final CharSet notWordClass;
    final CharSet spaceClass;
    final CharSet notSpaceClass;
    final CharSet digitClass;
    final CharSet notDigitClass;

    /**
     * Anything but a new line, for '.' without DOTALL.
     */
    final CharSet notNewLineClass;

    RegexStaticSets() {
        anyClass = CharSet.fromRangeString("\u0000", false).freeze();

        ecmaWordClass = CharSet.fromRangeString(ECMA_WORD_SET_TEXT, false).freeze();
        notEcmaWordClass = CharSet.fromRangeString(ECMA_WORD_SET_TEXT, true).freeze();
        ecmaSpaceClass = CharSet.fromRangeString(ECMA_SPACE_SET_TEXT, false).freeze();
        notEcmaSpaceClass = CharSet.fromRangeString(ECMA_SPACE_SET_TEXT, true).freeze();
        ecmaDigitClass = CharSet.fromRangeString(ECMA_DIGIT_SET_TEXT, false).freeze();
        notEcmaDigitClass = CharSet.fromRangeString(ECMA_DIGIT_SET_TEXT, true).freeze();

        wordClass = CharSet.fromCategories(false, "L", "Mn", "Nd", "Pc").freeze();
        notWordClass = CharSet.fromCategories(true, "L", "Mn", "Nd", "Pc").freeze();
        spaceClass = CharSet.fromCategories(false, Category.SPACE_CATEGORY_TEXT).freeze();
        notSpaceClass = CharSet.fromCategories(true, Category.SPACE_CATEGORY_TEXT).freeze();
        digitClass = CharSet.fromCategories(false, "Nd").freeze();
        notDigitClass = CharSet.fromCategories(true, "Nd").freeze();

        notNewLineClass = CharSet.fromRangeString("\n\u000B", true).freeze();
    }
}
