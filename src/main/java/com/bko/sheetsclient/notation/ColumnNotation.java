package com.bko.sheetsclient.notation;

/**
 * Converts zero-indexed column numbers into spreadsheet column letters.
 * 0 = A, 25 = Z, 26 = AA, 701 = ZZ, 702 = AAA, 18277 = ZZZ.
 *
 * <p>Letters form a bijective base-26 numeral: there is no zero digit, so each name length
 * covers its own block of columns ([0, 25], [26, 701], [702, 18277]).
 */
public final class ColumnNotation {
    /** The last column that fits in three letters (ZZZ). */
    public static final int MAX_COLUMN = 18277;

    private static final int RADIX = 26;
    private static final int MAX_LETTERS = 3;

    private ColumnNotation() {
    }

    public static String encode(int column) {
        if (column < 0 || column > MAX_COLUMN) {
            throw new ColumnOutOfRangeException(column);
        }

        char[] letters = new char[MAX_LETTERS];
        int pos = MAX_LETTERS;
        int remaining = column + 1; // 1-based for the bijective digits

        while (remaining > 0) {
            int digit = (remaining - 1) % RADIX;
            letters[--pos] = (char) ('A' + digit);
            remaining = (remaining - 1) / RADIX;
        }

        return new String(letters, pos, MAX_LETTERS - pos);
    }
}
