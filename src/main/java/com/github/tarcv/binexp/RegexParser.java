package com.github.tarcv.binexp;

import static com.github.tarcv.binexp.UErrorCode.*;

/**
 * Recursive descent parser from pattern text to a {@link RegexNode} tree.
 * <p>
 * Supported syntax: literals and escaped metacharacters; the escapes
 * {@code \t \n \r \f \v \a \e \0oo \xHH \x{H..} \cX} and a backslash-u escape
 * with four hex digits; {@code .}; bracket classes with negation, ranges,
 * {@code \d \D \w \W \s \S \p{..} \P{..}} and subtraction {@code [a-z-[aeiou]]};
 * the anchors {@code ^ $ \A \z \Z \b \B}; groups {@code ( )}, {@code (?: )},
 * {@code (?<name> )}, {@code (?= )}, {@code (?! )}, {@code (?> )} and inline
 * options {@code (?ims-ims)} and {@code (?ims-ims: )}; the quantifiers
 * {@code * + ? {n} {n,} {n,m}}, each optionally lazy; and alternation.
 */
final class RegexParser {
    private static final int MAX_QUANTIFIER = 0x00ffffff;

    private final String pattern;
    private final int length;
    private final UnicodePropertyResolver resolver;
    private int position;

    private boolean ignoreCase;
    private boolean multiline;
    private boolean dotAll;
    private final boolean ecma;

    private RegexParser(final String pattern, final long flags, final UnicodePropertyResolver resolver) {
        this.pattern = pattern;
        this.length = pattern.length();
        this.resolver = resolver;
        this.ignoreCase = (flags & URegexpFlag.UREGEX_CASE_INSENSITIVE.flag) != 0;
        this.multiline = (flags & URegexpFlag.UREGEX_MULTILINE.flag) != 0;
        this.dotAll = (flags & URegexpFlag.UREGEX_DOTALL.flag) != 0;
        this.ecma = (flags & URegexpFlag.UREGEX_ECMASCRIPT.flag) != 0;
    }

    /**
     * @throws RegexParseException if the pattern is malformed
     * @throws UErrorException     with {@link UErrorCode#U_REGEX_UNIMPLEMENTED} for recognized but unsupported constructs
     */
    static RegexNode parse(final String pattern, final long flags, final UnicodePropertyResolver resolver) {
        RegexParser parser = new RegexParser(pattern, flags, resolver);
        RegexNode tree = parser.parseAlternation();
        if (parser.position < parser.length) {
            // the only way to stop early is an unbalanced ')'
            throw parser.error(U_REGEX_MISMATCHED_PAREN);
        }
        return tree.reduce();
    }

    //------------------------------------------------------------------------------
    //
    //   Structure
    //
    //------------------------------------------------------------------------------

    private RegexNode parseAlternation() {
        RegexNode first = parseConcatenation();
        if (!peekIs('|')) {
            return first;
        }
        RegexNode alternate = new RegexNode(RegexNode.Type.ALTERNATE);
        alternate.children.add(first);
        while (peekIs('|')) {
            position++;
            alternate.children.add(parseConcatenation());
        }
        return alternate;
    }

    private RegexNode parseConcatenation() {
        RegexNode concat = new RegexNode(RegexNode.Type.CONCATENATE);
        while (position < length) {
            int c = pattern.codePointAt(position);
            if (c == '|' || c == ')') {
                break;
            }
            RegexNode atom = parseAtom();
            if (atom == null) {
                // inline option change, applies to the rest of the enclosing group
                continue;
            }
            concat.children.add(parseQuantifier(atom));
        }
        return concat;
    }

    private RegexNode parseQuantifier(final RegexNode atom) {
        if (position >= length) {
            return atom;
        }
        int quantifierStart = position;
        int min;
        int max;
        switch (pattern.charAt(position)) {
            case '*':
                position++;
                min = 0;
                max = RegexNode.INFINITE;
                break;
            case '+':
                position++;
                min = 1;
                max = RegexNode.INFINITE;
                break;
            case '?':
                position++;
                min = 0;
                max = 1;
                break;
            case '{': {
                int[] interval = tryParseInterval();
                if (interval == null) {
                    return atom;
                }
                min = interval[0];
                max = interval[1];
                break;
            }
            default:
                return atom;
        }
        if (!isQuantifiable(atom)) {
            throw error(U_REGEX_RULE_SYNTAX, quantifierStart);
        }
        boolean lazy = false;
        if (peekIs('?')) {
            position++;
            lazy = true;
        }
        if (position < length && isQuantifierStart(position)) {
            // nested quantifier, like a**
            throw error(U_REGEX_RULE_SYNTAX);
        }
        return RegexNode.loop(atom, min, max, lazy);
    }

    private static boolean isQuantifiable(final RegexNode atom) {
        switch (atom.type) {
            case BOL:
            case EOL:
            case BEGINNING:
            case END:
            case ENDZ:
            case BOUNDARY:
            case NONBOUNDARY:
                return false;
            default:
                return true;
        }
    }

    private boolean isQuantifierStart(final int pos) {
        char c = pattern.charAt(pos);
        if (c == '*' || c == '+' || c == '?') {
            return true;
        }
        if (c == '{') {
            int saved = position;
            position = pos;
            try {
                return tryParseInterval() != null;
            } finally {
                position = saved;
            }
        }
        return false;
    }

    /**
     * Parses {n}, {n,} or {n,m} at the current position. Anything else starting with
     * '{' is a literal brace, and null is returned with the position unchanged.
     */
    private int[] tryParseInterval() {
        int p = position + 1;
        int digitsStart = p;
        while (p < length && isAsciiDigit(pattern.charAt(p))) {
            p++;
        }
        if (p == digitsStart) {
            return null;
        }
        int minEnd = p;
        int maxStart = -1;
        int maxEnd = -1;
        if (p < length && pattern.charAt(p) == ',') {
            p++;
            maxStart = p;
            while (p < length && isAsciiDigit(pattern.charAt(p))) {
                p++;
            }
            maxEnd = p;
        }
        if (p >= length || pattern.charAt(p) != '}') {
            return null;
        }
        int min = parseDecimal(digitsStart, minEnd);
        int max;
        if (maxStart < 0) {
            max = min;
        } else if (maxStart == maxEnd) {
            max = RegexNode.INFINITE;
        } else {
            max = parseDecimal(maxStart, maxEnd);
            if (max < min) {
                throw error(U_REGEX_MAX_LT_MIN, p);
            }
        }
        position = p + 1;
        return new int[]{min, max};
    }

    private int parseDecimal(final int start, final int end) {
        long value = 0;
        for (int i = start; i < end; i++) {
            value = value * 10 + (pattern.charAt(i) - '0');
            if (value > MAX_QUANTIFIER) {
                throw error(U_REGEX_NUMBER_TOO_BIG, start);
            }
        }
        return (int) value;
    }

    /**
     * @return the parsed atom, or null for an inline option setting that produced no node
     */
    private RegexNode parseAtom() {
        int c = pattern.codePointAt(position);
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                position++;
                return RegexNode.set(parseCharClass(), ignoreCase);
            case '.':
                position++;
                return RegexNode.set(dotAll
                        ? RegexStaticSets.INSTANCE.anyClass
                        : RegexStaticSets.INSTANCE.notNewLineClass, false);
            case '^': {
                position++;
                RegexNode node = new RegexNode(RegexNode.Type.BOL);
                node.multiline = multiline;
                return node;
            }
            case '$': {
                position++;
                RegexNode node = new RegexNode(RegexNode.Type.EOL);
                node.multiline = multiline;
                return node;
            }
            case '\\':
                return parseBackslash();
            case '*':
            case '+':
            case '?':
                throw error(U_REGEX_RULE_SYNTAX);
            case '{':
                if (isQuantifierStart(position)) {
                    throw error(U_REGEX_RULE_SYNTAX);
                }
                position++;
                return RegexNode.one(c, ignoreCase);
            default:
                position += Character.charCount(c);
                return RegexNode.one(c, ignoreCase);
        }
    }

    private RegexNode parseGroup() {
        int groupStart = position;
        position++; // (
        RegexNode.Type type = RegexNode.Type.GROUP;
        boolean savedIgnoreCase = ignoreCase;
        boolean savedMultiline = multiline;
        boolean savedDotAll = dotAll;

        if (peekIs('?')) {
            position++;
            if (position >= length) {
                throw error(U_REGEX_RULE_SYNTAX);
            }
            char kind = pattern.charAt(position);
            switch (kind) {
                case ':':
                    position++;
                    break;
                case '=':
                    position++;
                    type = RegexNode.Type.REQUIRE;
                    break;
                case '!':
                    position++;
                    type = RegexNode.Type.PREVENT;
                    break;
                case '>':
                    position++;
                    type = RegexNode.Type.ATOMIC;
                    break;
                case '<':
                    if (position + 1 < length
                            && (pattern.charAt(position + 1) == '=' || pattern.charAt(position + 1) == '!')) {
                        throw new UErrorException(U_REGEX_UNIMPLEMENTED,
                                "Look-behind is not supported, at offset " + groupStart);
                    }
                    parseGroupName('>');
                    break;
                case '\'':
                    parseGroupName('\'');
                    break;
                case '#':
                    skipComment();
                    return new RegexNode(RegexNode.Type.EMPTY);
                default:
                    if (parseInlineOptions()) {
                        // (?i) form: options stay changed, nothing to group
                        return null;
                    }
                    break;
            }
        }

        RegexNode body = parseAlternation();
        if (!peekIs(')')) {
            throw error(U_REGEX_MISMATCHED_PAREN, length);
        }
        position++;
        ignoreCase = savedIgnoreCase;
        multiline = savedMultiline;
        dotAll = savedDotAll;
        return RegexNode.withChild(type, body);
    }

    private void parseGroupName(final char terminator) {
        position++; // < or '
        int nameStart = position;
        while (position < length && isWordAscii(pattern.charAt(position))) {
            position++;
        }
        if (position == nameStart || position >= length || pattern.charAt(position) != terminator) {
            throw error(U_REGEX_RULE_SYNTAX);
        }
        position++;
    }

    private void skipComment() {
        int close = pattern.indexOf(')', position);
        if (close < 0) {
            throw error(U_REGEX_MISMATCHED_PAREN, length);
        }
        position = close + 1;
    }

    /**
     * Parses ims-ims followed by ')' or ':'.
     *
     * @return true for the ')' form, false for the ':' form which opens a group
     */
    private boolean parseInlineOptions() {
        boolean on = true;
        while (position < length) {
            char c = pattern.charAt(position);
            switch (c) {
                case 'i':
                    ignoreCase = on;
                    break;
                case 'm':
                    multiline = on;
                    break;
                case 's':
                    dotAll = on;
                    break;
                case 'x':
                    throw new UErrorException(U_REGEX_UNIMPLEMENTED,
                            "Free-spacing mode is not supported, at offset " + position);
                case '-':
                    if (!on) {
                        throw error(U_REGEX_RULE_SYNTAX);
                    }
                    on = false;
                    break;
                case ')':
                    position++;
                    return true;
                case ':':
                    position++;
                    return false;
                default:
                    throw error(U_REGEX_RULE_SYNTAX);
            }
            position++;
        }
        throw error(U_REGEX_MISMATCHED_PAREN, length);
    }

    //------------------------------------------------------------------------------
    //
    //   Escapes
    //
    //------------------------------------------------------------------------------

    private RegexNode parseBackslash() {
        int escapeStart = position;
        position++; // backslash
        if (position >= length) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
        }
        int c = pattern.codePointAt(position);
        switch (c) {
            case 'A':
                position++;
                return new RegexNode(RegexNode.Type.BEGINNING);
            case 'z':
                position++;
                return new RegexNode(RegexNode.Type.END);
            case 'Z':
                position++;
                return new RegexNode(RegexNode.Type.ENDZ);
            case 'b':
            case 'B': {
                position++;
                RegexNode node = new RegexNode(c == 'b' ? RegexNode.Type.BOUNDARY : RegexNode.Type.NONBOUNDARY);
                node.ecma = ecma;
                return node;
            }
            case 'd':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.ecmaDigitClass
                        : RegexStaticSets.INSTANCE.digitClass, false);
            case 'D':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.notEcmaDigitClass
                        : RegexStaticSets.INSTANCE.notDigitClass, false);
            case 'w':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.ecmaWordClass
                        : RegexStaticSets.INSTANCE.wordClass, false);
            case 'W':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.notEcmaWordClass
                        : RegexStaticSets.INSTANCE.notWordClass, false);
            case 's':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.ecmaSpaceClass
                        : RegexStaticSets.INSTANCE.spaceClass, false);
            case 'S':
                position++;
                return RegexNode.set(ecma ? RegexStaticSets.INSTANCE.notEcmaSpaceClass
                        : RegexStaticSets.INSTANCE.notSpaceClass, false);
            case 'p':
            case 'P': {
                position++;
                String name = parsePropertyName();
                CharSet set = new CharSet();
                set.addCategory(name, c == 'P', ignoreCase, pattern, resolver);
                return RegexNode.set(set, ignoreCase);
            }
            case 'k':
            case 'G':
                throw new UErrorException(U_REGEX_UNIMPLEMENTED,
                        "\\" + (char) c + " is not supported, at offset " + escapeStart);
            default:
                if (c >= '1' && c <= '9') {
                    throw new UErrorException(U_REGEX_UNIMPLEMENTED,
                            "Back references are not supported, at offset " + escapeStart);
                }
                return RegexNode.one(parseCharEscape(escapeStart, false), ignoreCase);
        }
    }

    /**
     * Parses the part of a character escape after the backslash.
     *
     * @param inClass true inside brackets, where \b is a backspace
     */
    private int parseCharEscape(final int escapeStart, final boolean inClass) {
        int c = pattern.codePointAt(position);
        position += Character.charCount(c);
        switch (c) {
            case 't':
                return 0x09;
            case 'n':
                return 0x0a;
            case 'r':
                return 0x0d;
            case 'f':
                return 0x0c;
            case 'v':
                return 0x0b;
            case 'a':
                return 0x07;
            case 'e':
                return 0x1b;
            case 'b':
                if (inClass) {
                    return 0x08;
                }
                break;
            case '0':
                return parseOctal();
            case 'x':
                if (peekIs('{')) {
                    return parseBracedHex(escapeStart);
                }
                return parseHex(2, escapeStart);
            case 'u':
                return parseHex(4, escapeStart);
            case 'c': {
                if (position >= length || !isAsciiLetter(pattern.charAt(position))) {
                    throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
                }
                return pattern.charAt(position++) & 0x1f;
            }
            default:
                break;
        }
        if (c < 0x80 && (isAsciiLetter((char) c) || isAsciiDigit((char) c))) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
        }
        return c;
    }

    /**
     * Up to two more octal digits after \0.
     */
    private int parseOctal() {
        int value = 0;
        for (int i = 0; i < 2 && position < length; i++) {
            char d = pattern.charAt(position);
            if (d < '0' || d > '7') {
                break;
            }
            value = value * 8 + (d - '0');
            position++;
        }
        return value;
    }

    private int parseHex(final int digits, final int escapeStart) {
        if (position + digits > length) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
        }
        int value = 0;
        for (int i = 0; i < digits; i++) {
            int d = Character.digit(pattern.charAt(position++), 16);
            if (d < 0) {
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
            }
            value = value * 16 + d;
        }
        return value;
    }

    private int parseBracedHex(final int escapeStart) {
        position++; // {
        long value = 0;
        int digitsStart = position;
        while (position < length && pattern.charAt(position) != '}') {
            int d = Character.digit(pattern.charAt(position++), 16);
            if (d < 0) {
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
            }
            value = value * 16 + d;
            if (value > Character.MAX_CODE_POINT) {
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
            }
        }
        if (position >= length || position == digitsStart) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, escapeStart);
        }
        position++; // }
        return (int) value;
    }

    private String parsePropertyName() {
        int nameStart = position;
        if (!peekIs('{')) {
            throw error(U_REGEX_PROPERTY_SYNTAX, nameStart);
        }
        int close = pattern.indexOf('}', position);
        if (close < 0 || close == position + 1) {
            throw error(U_REGEX_PROPERTY_SYNTAX, nameStart);
        }
        String name = pattern.substring(position + 1, close);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isWordAscii(c) && c != '-' && c != ' ' && c != '=') {
                throw error(U_REGEX_PROPERTY_SYNTAX, nameStart);
            }
        }
        position = close + 1;
        return name;
    }

    //------------------------------------------------------------------------------
    //
    //   Bracket classes
    //
    //------------------------------------------------------------------------------

    /**
     * Parses a class after its opening '[', up to and including the closing ']'.
     */
    private CharSet parseCharClass() {
        int classStart = position - 1;
        CharSet set = new CharSet();
        if (peekIs('^')) {
            position++;
            set.setNegated(true);
        }
        boolean first = true;
        while (true) {
            if (position >= length) {
                throw error(U_REGEX_MISSING_CLOSE_BRACKET, classStart);
            }
            int c = pattern.codePointAt(position);
            if (c == ']' && !first) {
                position++;
                return set;
            }
            first = false;

            if (c == '-' && position + 1 < length && pattern.charAt(position + 1) == '[') {
                position += 2;
                set.addSubtraction(parseCharClass());
                if (!peekIs(']')) {
                    // a subtraction has to be the last item of its class
                    throw error(U_REGEX_RULE_SYNTAX);
                }
                continue;
            }

            int rangeStart;
            if (c == '\\') {
                int escapeStart = position;
                position++;
                if (position >= length) {
                    throw error(U_REGEX_MISSING_CLOSE_BRACKET, classStart);
                }
                if (addClassEscape(set, pattern.codePointAt(position))) {
                    continue;
                }
                rangeStart = parseCharEscape(escapeStart, true);
            } else {
                position += Character.charCount(c);
                rangeStart = c;
            }

            if (position + 1 < length && pattern.charAt(position) == '-'
                    && pattern.charAt(position + 1) != ']' && pattern.charAt(position + 1) != '[') {
                int dashPos = position;
                position++;
                int rangeEnd = parseClassRangeEnd(classStart);
                if (rangeEnd < rangeStart) {
                    throw error(U_REGEX_INVALID_RANGE, dashPos);
                }
                set.addRange(rangeStart, rangeEnd);
            } else {
                set.addChar(rangeStart);
            }
        }
    }

    private int parseClassRangeEnd(final int classStart) {
        int c = pattern.codePointAt(position);
        if (c != '\\') {
            position += Character.charCount(c);
            return c;
        }
        int escapeStart = position;
        position++;
        if (position >= length) {
            throw error(U_REGEX_MISSING_CLOSE_BRACKET, classStart);
        }
        int next = pattern.codePointAt(position);
        if ("dDwWsSpP".indexOf(next) >= 0) {
            // a class can not end a range
            throw error(U_REGEX_INVALID_RANGE, escapeStart);
        }
        return parseCharEscape(escapeStart, true);
    }

    /**
     * Handles the class escapes \d \D \w \W \s \S \p \P inside brackets.
     *
     * @return false if {@code c} does not start one of them, with nothing consumed
     */
    private boolean addClassEscape(final CharSet set, final int c) {
        switch (c) {
            case 'd':
            case 'D':
                position++;
                set.addDigit(ecma, c == 'D', pattern);
                return true;
            case 'w':
            case 'W':
                position++;
                set.addWord(ecma, c == 'W');
                return true;
            case 's':
            case 'S':
                position++;
                set.addSpace(ecma, c == 'S');
                return true;
            case 'p':
            case 'P': {
                position++;
                String name = parsePropertyName();
                set.addCategory(name, c == 'P', ignoreCase, pattern, resolver);
                return true;
            }
            default:
                return false;
        }
    }

    //------------------------------------------------------------------------------
    //
    //   Helpers
    //
    //------------------------------------------------------------------------------

    private boolean peekIs(final char c) {
        return position < length && pattern.charAt(position) == c;
    }

    private static boolean isAsciiDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isWordAscii(final char c) {
        return isAsciiLetter(c) || isAsciiDigit(c) || c == '_';
    }

    private RegexParseException error(final UErrorCode code) {
        return error(code, position);
    }

    /**
     * Builds a parse error with the line and the offset within the line of {@code errorPos},
     * and up to {@link Util#U_PARSE_CONTEXT_LEN} chars of context on each side.
     */
    private RegexParseException error(final UErrorCode code, final int errorPos) {
        // an error at the end of the pattern is reported on its last char
        int pos = Math.max(0, Math.min(errorPos, length - 1));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < pos; i++) {
            if (pattern.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int preStart = Math.max(lineStart, pos - Util.U_PARSE_CONTEXT_LEN);
        int postEnd = Math.min(length, pos + Util.U_PARSE_CONTEXT_LEN);
        return new RegexParseException(code, line, pos - lineStart + 1,
                pattern.substring(preStart, pos).toCharArray(),
                pattern.substring(pos, postEnd).toCharArray());
    }
}
