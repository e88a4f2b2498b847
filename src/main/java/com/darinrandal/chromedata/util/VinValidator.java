package com.darinrandal.chromedata.util;

import java.util.Locale;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Verifies the check digit of a 17 character Vehicle Identification Number
 * (ISO 3779 / North American check digit scheme). Malformed input is reported
 * as invalid rather than raising an error.
 */
@NonNullByDefault
public final class VinValidator {

    public static final int VIN_LENGTH = 17;
    public static final int CHECK_DIGIT_POSITION = 8;

    // ASCII case folding only: U+212A KELVIN SIGN must not match 'k'
    private static final Pattern WELL_FORMED = Pattern.compile("^[a-hj-npr-z0-9]{17}$", Pattern.CASE_INSENSITIVE);

    private static final int[] WEIGHTS = { 8, 7, 6, 5, 4, 3, 2, 10, 0, 9, 8, 7, 6, 5, 4, 3, 2 };

    // indexed by letter - 'a'; 0 marks letters without a transliteration (i, o, q)
    private static final int[] TRANSLITERATIONS = {
            1, 2, 3, 4, 5, 6, 7, 8, 0, // a-i
            1, 2, 3, 4, 5, 0, 7, 0, 9, // j-r
            2, 3, 4, 5, 6, 7, 8, 9 // s-z
    };

    private VinValidator() {
    }

    /**
     * Returns whether the VIN is well formed and carries the correct check digit.
     */
    public static boolean isValid(@Nullable String vin) {
        String normalized = normalize(vin);
        if (normalized == null) {
            return false;
        }
        return normalized.charAt(CHECK_DIGIT_POSITION) == checkCharacter(normalized);
    }

    /**
     * Returns whether the VIN has 17 characters from the permitted alphabet,
     * without looking at the check digit.
     */
    public static boolean isWellFormed(@Nullable String vin) {
        return normalize(vin) != null;
    }

    /**
     * Computes the expected check character (lower case {@code x} for ten) of a
     * well formed VIN, or {@code null} when the VIN is malformed.
     */
    public static @Nullable Character computeCheckCharacter(@Nullable String vin) {
        String normalized = normalize(vin);
        return normalized == null ? null : checkCharacter(normalized);
    }

    private static @Nullable String normalize(@Nullable String vin) {
        if (vin == null) {
            return null;
        }
        if (!WELL_FORMED.matcher(vin).matches()) {
            return null;
        }
        return vin.toLowerCase(Locale.ROOT);
    }

    private static char checkCharacter(String normalized) {
        int sum = 0;
        for (int i = 0; i < VIN_LENGTH; i++) {
            sum += valueOf(normalized.charAt(i)) * WEIGHTS[i];
        }
        int checkDigit = sum % 11;
        return checkDigit == 10 ? 'x' : (char) ('0' + checkDigit);
    }

    private static int valueOf(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        return TRANSLITERATIONS[c - 'a'];
    }
}
