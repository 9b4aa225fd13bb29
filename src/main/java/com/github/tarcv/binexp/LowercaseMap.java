package com.github.tarcv.binexp;

import static com.github.tarcv.binexp.LowercaseMap.Op.*;

/**
 * Table of intervals on which the lowercase function has a simple form.
 * <p>
 * Let U be the set of Unicode code points and L the lowercase mapping from U to U.
 * To match a character class case-insensitively an interval I = [chMin, chMax]
 * has to be mapped to a set A with L(I) contained in A and A contained in the
 * union of I and L(I).
 * <p>
 * The entries below partition the cased part of U into intervals on which L is
 * non-decreasing, so for any J = [a, b] inside one entry L(J) is contained in
 * [L(a), L(b)]. On each entry L has one of the forms of {@link Op}, and for each
 * of them [L(a), L(b)] is also contained in the union of J and L(J).
 */
final class LowercaseMap {
    enum Op {
        /** L(ch) = data */
        SET {
            @Override
            int apply(final int ch, final int data) {
                return data;
            }
        },
        /** L(ch) = ch + data */
        ADD {
            @Override
            int apply(final int ch, final int data) {
                return ch + data;
            }
        },
        /** L(ch) = ch | 1 */
        BOR {
            @Override
            int apply(final int ch, final int data) {
                return ch | 1;
            }
        },
        /** L(ch) = ch + (ch &amp; 1) */
        BAD {
            @Override
            int apply(final int ch, final int data) {
                return ch + (ch & 1);
            }
        };

        abstract int apply(int ch, int data);
    }

    final int chMin;
    final int chMax;
    final Op op;
    final int data;

    private LowercaseMap(final int chMin, final int chMax, final Op op, final int data) {
        assert chMin <= chMax;
        this.chMin = chMin;
        this.chMax = chMax;
        this.op = op;
        this.data = data;
    }

    private static LowercaseMap lc(final int chMin, final int chMax, final Op op, final int data) {
        return new LowercaseMap(chMin, chMax, op, data);
    }

    /**
     * Sorted by chMin, entries never overlap. Every character with a simple
     * lowercase mapping in {@link com.ibm.icu.lang.UCharacter} lies in one entry.
     */
    static final LowercaseMap[] TABLE = {
            lc(0x0041, 0x005A, ADD, 32),
            lc(0x00C0, 0x00D6, ADD, 32),
            lc(0x00D8, 0x00DE, ADD, 32),
            lc(0x0100, 0x012E, BOR, 0),
            lc(0x0130, 0x0130, SET, 0x0069),
            lc(0x0132, 0x0136, BOR, 0),
            lc(0x0139, 0x0147, BAD, 0),
            lc(0x014A, 0x0176, BOR, 0),
            lc(0x0178, 0x0178, SET, 0x00FF),
            lc(0x0179, 0x017D, BAD, 0),
            lc(0x0181, 0x0181, SET, 0x0253),
            lc(0x0182, 0x0184, BOR, 0),
            lc(0x0186, 0x0186, SET, 0x0254),
            lc(0x0187, 0x0187, SET, 0x0188),
            lc(0x0189, 0x018A, ADD, 205),
            lc(0x018B, 0x018B, SET, 0x018C),
            lc(0x018E, 0x018E, SET, 0x01DD),
            lc(0x018F, 0x018F, SET, 0x0259),
            lc(0x0190, 0x0190, SET, 0x025B),
            lc(0x0191, 0x0191, SET, 0x0192),
            lc(0x0193, 0x0193, SET, 0x0260),
            lc(0x0194, 0x0194, SET, 0x0263),
            lc(0x0196, 0x0196, SET, 0x0269),
            lc(0x0197, 0x0197, SET, 0x0268),
            lc(0x0198, 0x0198, SET, 0x0199),
            lc(0x019C, 0x019C, SET, 0x026F),
            lc(0x019D, 0x019D, SET, 0x0272),
            lc(0x019F, 0x019F, SET, 0x0275),
            lc(0x01A0, 0x01A4, BOR, 0),
            lc(0x01A6, 0x01A6, SET, 0x0280),
            lc(0x01A7, 0x01A7, SET, 0x01A8),
            lc(0x01A9, 0x01A9, SET, 0x0283),
            lc(0x01AC, 0x01AC, SET, 0x01AD),
            lc(0x01AE, 0x01AE, SET, 0x0288),
            lc(0x01AF, 0x01AF, SET, 0x01B0),
            lc(0x01B1, 0x01B2, ADD, 217),
            lc(0x01B3, 0x01B5, BAD, 0),
            lc(0x01B7, 0x01B7, SET, 0x0292),
            lc(0x01B8, 0x01B8, SET, 0x01B9),
            lc(0x01BC, 0x01BC, SET, 0x01BD),
            lc(0x01C4, 0x01C5, SET, 0x01C6),
            lc(0x01C7, 0x01C8, SET, 0x01C9),
            lc(0x01CA, 0x01CB, SET, 0x01CC),
            lc(0x01CD, 0x01DB, BAD, 0),
            lc(0x01DE, 0x01EE, BOR, 0),
            lc(0x01F1, 0x01F2, SET, 0x01F3),
            lc(0x01F4, 0x01F4, SET, 0x01F5),
            lc(0x01F6, 0x01F6, SET, 0x0195),
            lc(0x01F7, 0x01F7, SET, 0x01BF),
            lc(0x01F8, 0x021E, BOR, 0),
            lc(0x0220, 0x0220, SET, 0x019E),
            lc(0x0222, 0x0232, BOR, 0),
            lc(0x023A, 0x023A, SET, 0x2C65),
            lc(0x023B, 0x023B, SET, 0x023C),
            lc(0x023D, 0x023D, SET, 0x019A),
            lc(0x023E, 0x023E, SET, 0x2C66),
            lc(0x0241, 0x0241, SET, 0x0242),
            lc(0x0243, 0x0243, SET, 0x0180),
            lc(0x0244, 0x0244, SET, 0x0289),
            lc(0x0245, 0x0245, SET, 0x028C),
            lc(0x0246, 0x024E, BOR, 0),
            lc(0x0370, 0x0372, BOR, 0),
            lc(0x0376, 0x0376, SET, 0x0377),
            lc(0x037F, 0x037F, SET, 0x03F3),
            lc(0x0386, 0x0386, SET, 0x03AC),
            lc(0x0388, 0x038A, ADD, 37),
            lc(0x038C, 0x038C, SET, 0x03CC),
            lc(0x038E, 0x038F, ADD, 63),
            lc(0x0391, 0x03A1, ADD, 32),
            lc(0x03A3, 0x03AB, ADD, 32),
            lc(0x03CF, 0x03CF, SET, 0x03D7),
            lc(0x03D8, 0x03EE, BOR, 0),
            lc(0x03F4, 0x03F4, SET, 0x03B8),
            lc(0x03F7, 0x03F7, SET, 0x03F8),
            lc(0x03F9, 0x03F9, SET, 0x03F2),
            lc(0x03FA, 0x03FA, SET, 0x03FB),
            lc(0x03FD, 0x03FF, ADD, -130),
            lc(0x0400, 0x040F, ADD, 80),
            lc(0x0410, 0x042F, ADD, 32),
            lc(0x0460, 0x0480, BOR, 0),
            lc(0x048A, 0x04BE, BOR, 0),
            lc(0x04C0, 0x04C0, SET, 0x04CF),
            lc(0x04C1, 0x04CD, BAD, 0),
            lc(0x04D0, 0x052E, BOR, 0),
            lc(0x0531, 0x0556, ADD, 48),
            lc(0x10A0, 0x10C5, ADD, 7264),
            lc(0x10C7, 0x10C7, SET, 0x2D27),
            lc(0x10CD, 0x10CD, SET, 0x2D2D),
            lc(0x13A0, 0x13EF, ADD, 38864),
            lc(0x13F0, 0x13F5, ADD, 8),
            lc(0x1C90, 0x1CBA, ADD, -3008),
            lc(0x1CBD, 0x1CBF, ADD, -3008),
            lc(0x1E00, 0x1E94, BOR, 0),
            lc(0x1E9E, 0x1E9E, SET, 0x00DF),
            lc(0x1EA0, 0x1EFE, BOR, 0),
            lc(0x1F08, 0x1F0F, ADD, -8),
            lc(0x1F18, 0x1F1D, ADD, -8),
            lc(0x1F28, 0x1F2F, ADD, -8),
            lc(0x1F38, 0x1F3F, ADD, -8),
            lc(0x1F48, 0x1F4D, ADD, -8),
            lc(0x1F59, 0x1F59, SET, 0x1F51),
            lc(0x1F5B, 0x1F5B, SET, 0x1F53),
            lc(0x1F5D, 0x1F5D, SET, 0x1F55),
            lc(0x1F5F, 0x1F5F, SET, 0x1F57),
            lc(0x1F68, 0x1F6F, ADD, -8),
            lc(0x1F88, 0x1F8F, ADD, -8),
            lc(0x1F98, 0x1F9F, ADD, -8),
            lc(0x1FA8, 0x1FAF, ADD, -8),
            lc(0x1FB8, 0x1FB9, ADD, -8),
            lc(0x1FBA, 0x1FBB, ADD, -74),
            lc(0x1FBC, 0x1FBC, SET, 0x1FB3),
            lc(0x1FC8, 0x1FCB, ADD, -86),
            lc(0x1FCC, 0x1FCC, SET, 0x1FC3),
            lc(0x1FD8, 0x1FD9, ADD, -8),
            lc(0x1FDA, 0x1FDB, ADD, -100),
            lc(0x1FE8, 0x1FE9, ADD, -8),
            lc(0x1FEA, 0x1FEB, ADD, -112),
            lc(0x1FEC, 0x1FEC, SET, 0x1FE5),
            lc(0x1FF8, 0x1FF9, ADD, -128),
            lc(0x1FFA, 0x1FFB, ADD, -126),
            lc(0x1FFC, 0x1FFC, SET, 0x1FF3),
            lc(0x2126, 0x2126, SET, 0x03C9),
            lc(0x212A, 0x212A, SET, 0x006B),
            lc(0x212B, 0x212B, SET, 0x00E5),
            lc(0x2132, 0x2132, SET, 0x214E),
            lc(0x2160, 0x216F, ADD, 16),
            lc(0x2183, 0x2183, SET, 0x2184),
            lc(0x24B6, 0x24CF, ADD, 26),
            lc(0x2C00, 0x2C2F, ADD, 48),
            lc(0x2C60, 0x2C60, SET, 0x2C61),
            lc(0x2C62, 0x2C62, SET, 0x026B),
            lc(0x2C63, 0x2C63, SET, 0x1D7D),
            lc(0x2C64, 0x2C64, SET, 0x027D),
            lc(0x2C67, 0x2C6B, BAD, 0),
            lc(0x2C6D, 0x2C6D, SET, 0x0251),
            lc(0x2C6E, 0x2C6E, SET, 0x0271),
            lc(0x2C6F, 0x2C6F, SET, 0x0250),
            lc(0x2C70, 0x2C70, SET, 0x0252),
            lc(0x2C72, 0x2C72, SET, 0x2C73),
            lc(0x2C75, 0x2C75, SET, 0x2C76),
            lc(0x2C7E, 0x2C7F, ADD, -10815),
            lc(0x2C80, 0x2CE2, BOR, 0),
            lc(0x2CEB, 0x2CED, BAD, 0),
            lc(0x2CF2, 0x2CF2, SET, 0x2CF3),
            lc(0xA640, 0xA66C, BOR, 0),
            lc(0xA680, 0xA69A, BOR, 0),
            lc(0xA722, 0xA72E, BOR, 0),
            lc(0xA732, 0xA76E, BOR, 0),
            lc(0xA779, 0xA77B, BAD, 0),
            lc(0xA77D, 0xA77D, SET, 0x1D79),
            lc(0xA77E, 0xA786, BOR, 0),
            lc(0xA78B, 0xA78B, SET, 0xA78C),
            lc(0xA78D, 0xA78D, SET, 0x0265),
            lc(0xA790, 0xA792, BOR, 0),
            lc(0xA796, 0xA7A8, BOR, 0),
            lc(0xA7AA, 0xA7AA, SET, 0x0266),
            lc(0xA7AB, 0xA7AB, SET, 0x025C),
            lc(0xA7AC, 0xA7AC, SET, 0x0261),
            lc(0xA7AD, 0xA7AD, SET, 0x026C),
            lc(0xA7AE, 0xA7AE, SET, 0x026A),
            lc(0xA7B0, 0xA7B0, SET, 0x029E),
            lc(0xA7B1, 0xA7B1, SET, 0x0287),
            lc(0xA7B2, 0xA7B2, SET, 0x029D),
            lc(0xA7B3, 0xA7B3, SET, 0xAB53),
            lc(0xA7B4, 0xA7C2, BOR, 0),
            lc(0xA7C4, 0xA7C4, SET, 0xA794),
            lc(0xA7C5, 0xA7C5, SET, 0x0282),
            lc(0xA7C6, 0xA7C6, SET, 0x1D8E),
            lc(0xA7C7, 0xA7C9, BAD, 0),
            lc(0xA7D0, 0xA7D0, SET, 0xA7D1),
            lc(0xA7D6, 0xA7D8, BOR, 0),
            lc(0xA7F5, 0xA7F5, SET, 0xA7F6),
            lc(0xFF21, 0xFF3A, ADD, 32),
            lc(0x10400, 0x10427, ADD, 40),
            lc(0x104B0, 0x104D3, ADD, 40),
            lc(0x10570, 0x1057A, ADD, 39),
            lc(0x1057C, 0x1058A, ADD, 39),
            lc(0x1058C, 0x10592, ADD, 39),
            lc(0x10594, 0x10595, ADD, 39),
            lc(0x10C80, 0x10CB2, ADD, 64),
            lc(0x118A0, 0x118BF, ADD, 32),
            lc(0x16E40, 0x16E5F, ADD, 32),
            lc(0x1E900, 0x1E921, ADD, 34),
    };

    /**
     * @return index of the first entry whose chMax is not below {@code ch},
     * or {@code TABLE.length} if there is none.
     */
    static int firstEntryReaching(final int ch) {
        int i = 0;
        int iMax = TABLE.length;
        while (i < iMax) {
            int iMid = (i + iMax) >>> 1;
            if (TABLE[iMid].chMax < ch) {
                i = iMid + 1;
            } else {
                iMax = iMid;
            }
        }
        return i;
    }
}
