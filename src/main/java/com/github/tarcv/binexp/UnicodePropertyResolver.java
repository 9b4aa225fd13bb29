package com.github.tarcv.binexp;

/**
 * Resolves a \p{..} name that is not a general category into code point ranges.
 * <p>
 * Only the ranges of the returned set are used; the requested negation has to be
 * applied by the resolver itself.
 */
@FunctionalInterface
public interface UnicodePropertyResolver {
    /**
     * Fails for every name. Property names beyond the general categories are not
     * supported unless a caller supplies its own resolver.
     */
    UnicodePropertyResolver UNSUPPORTED = (name, negate, pattern) -> {
        throw new UErrorException(UErrorCode.U_REGEX_UNIMPLEMENTED,
                "Unicode property \"" + name + "\" is not supported (pattern \"" + pattern + "\")");
    };

    /**
     * @param name    the property name as written in the pattern
     * @param negate  true for \P{..}
     * @param pattern the pattern being compiled, for diagnostics
     * @return a set of ranges, never null
     * @throws UErrorException with {@link UErrorCode#U_REGEX_UNIMPLEMENTED} if the name is unknown
     */
    CharSet resolve(String name, boolean negate, String pattern);
}
