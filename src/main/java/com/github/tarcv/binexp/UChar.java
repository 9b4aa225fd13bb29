package com.github.tarcv.binexp;

import com.ibm.icu.lang.UCharacter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.ibm.icu.lang.UCharacterEnums.ECharacterCategory.*;

/**
 * General category masks and the short category names understood by \p{..}.
 */
final class UChar {
    private UChar() {
    }

    /**
     * U_GC_XX_MASK constants are bit flags corresponding to Unicode
     * general category values.
     * For each category, the nth bit is set if the numeric value of the
     * corresponding UCharCategory constant is n.
     * <p>
     * There are also some U_GC_Y_MASK constants for groups of general categories
     * like L for all letter categories.
     */
    static final long GC_CC_MASK = U_MASK(CONTROL);
    static final long GC_CF_MASK = U_MASK(FORMAT);
    static final long GC_CO_MASK = U_MASK(PRIVATE_USE);
    static final long GC_CS_MASK = U_MASK(SURROGATE);
    /**
     * Go and .NET style "C": unassigned code points are not included.
     */
    static final long GC_C_MASK = GC_CC_MASK | GC_CF_MASK | GC_CO_MASK | GC_CS_MASK;

    static final long GC_LU_MASK = U_MASK(UPPERCASE_LETTER);
    static final long GC_LL_MASK = U_MASK(LOWERCASE_LETTER);
    static final long GC_LT_MASK = U_MASK(TITLECASE_LETTER);
    static final long GC_LM_MASK = U_MASK(MODIFIER_LETTER);
    static final long GC_LO_MASK = U_MASK(OTHER_LETTER);
    static final long GC_L_MASK =
            (GC_LU_MASK | GC_LL_MASK | GC_LT_MASK | GC_LM_MASK | GC_LO_MASK);

    static final long GC_MN_MASK = U_MASK(NON_SPACING_MARK);
    static final long GC_ME_MASK = U_MASK(ENCLOSING_MARK);
    static final long GC_MC_MASK = U_MASK(COMBINING_SPACING_MARK);
    static final long GC_M_MASK = GC_MN_MASK | GC_ME_MASK | GC_MC_MASK;

    static final long GC_ND_MASK = U_MASK(DECIMAL_DIGIT_NUMBER);
    static final long GC_NL_MASK = U_MASK(LETTER_NUMBER);
    static final long GC_NO_MASK = U_MASK(OTHER_NUMBER);
    static final long GC_N_MASK = GC_ND_MASK | GC_NL_MASK | GC_NO_MASK;

    static final long GC_PC_MASK = U_MASK(CONNECTOR_PUNCTUATION);
    static final long GC_PD_MASK = U_MASK(DASH_PUNCTUATION);
    static final long GC_PS_MASK = U_MASK(START_PUNCTUATION);
    static final long GC_PE_MASK = U_MASK(END_PUNCTUATION);
    static final long GC_PI_MASK = U_MASK(INITIAL_PUNCTUATION);
    static final long GC_PF_MASK = U_MASK(FINAL_PUNCTUATION);
    static final long GC_PO_MASK = U_MASK(OTHER_PUNCTUATION);
    static final long GC_P_MASK =
            GC_PC_MASK | GC_PD_MASK | GC_PS_MASK | GC_PE_MASK | GC_PI_MASK | GC_PF_MASK | GC_PO_MASK;

    static final long GC_SM_MASK = U_MASK(MATH_SYMBOL);
    static final long GC_SC_MASK = U_MASK(CURRENCY_SYMBOL);
    static final long GC_SK_MASK = U_MASK(MODIFIER_SYMBOL);
    static final long GC_SO_MASK = U_MASK(OTHER_SYMBOL);
    static final long GC_S_MASK = GC_SM_MASK | GC_SC_MASK | GC_SK_MASK | GC_SO_MASK;

    static final long GC_ZS_MASK = U_MASK(SPACE_SEPARATOR);
    static final long GC_ZL_MASK = U_MASK(LINE_SEPARATOR);
    static final long GC_ZP_MASK = U_MASK(PARAGRAPH_SEPARATOR);
    static final long GC_Z_MASK = (GC_ZS_MASK | GC_ZL_MASK | GC_ZP_MASK);

    /**
     * Letters, non-spacing marks, decimal digits and connector punctuation: the \w class.
     */
    static final long GC_WORD_MASK = GC_L_MASK | GC_MN_MASK | GC_ND_MASK | GC_PC_MASK;

    private static final Map<String, Long> CATEGORY_MASKS;

    static {
        Map<String, Long> masks = new HashMap<>();
        masks.put("C", GC_C_MASK);
        masks.put("Cc", GC_CC_MASK);
        masks.put("Cf", GC_CF_MASK);
        masks.put("Co", GC_CO_MASK);
        masks.put("Cs", GC_CS_MASK);
        masks.put("L", GC_L_MASK);
        masks.put("Ll", GC_LL_MASK);
        masks.put("Lm", GC_LM_MASK);
        masks.put("Lo", GC_LO_MASK);
        masks.put("Lt", GC_LT_MASK);
        masks.put("Lu", GC_LU_MASK);
        masks.put("M", GC_M_MASK);
        masks.put("Mc", GC_MC_MASK);
        masks.put("Me", GC_ME_MASK);
        masks.put("Mn", GC_MN_MASK);
        masks.put("N", GC_N_MASK);
        masks.put("Nd", GC_ND_MASK);
        masks.put("Nl", GC_NL_MASK);
        masks.put("No", GC_NO_MASK);
        masks.put("P", GC_P_MASK);
        masks.put("Pc", GC_PC_MASK);
        masks.put("Pd", GC_PD_MASK);
        masks.put("Pe", GC_PE_MASK);
        masks.put("Pf", GC_PF_MASK);
        masks.put("Pi", GC_PI_MASK);
        masks.put("Po", GC_PO_MASK);
        masks.put("Ps", GC_PS_MASK);
        masks.put("S", GC_S_MASK);
        masks.put("Sc", GC_SC_MASK);
        masks.put("Sk", GC_SK_MASK);
        masks.put("Sm", GC_SM_MASK);
        masks.put("So", GC_SO_MASK);
        masks.put("Z", GC_Z_MASK);
        masks.put("Zl", GC_ZL_MASK);
        masks.put("Zp", GC_ZP_MASK);
        masks.put("Zs", GC_ZS_MASK);
        CATEGORY_MASKS = Collections.unmodifiableMap(masks);
    }

    /**
     * @return the mask for a short general category name, or 0 if the name is not one.
     */
    static long categoryMask(final String name) {
        Long mask = CATEGORY_MASKS.get(name);
        return mask != null ? mask : 0;
    }

    static boolean isInCategory(final int c, final long mask) {
        if (c < Character.MIN_CODE_POINT || c > Character.MAX_CODE_POINT) {
            return false;
        }
        return (U_MASK((byte) UCharacter.getType(c)) & mask) != 0;
    }

    /**
     * Get a single-bit bit set (a flag) from a bit number 0..31.
     */
    static long U_MASK(final byte category) {
        return 1L << category;
    }
}
