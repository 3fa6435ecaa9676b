package com.creator.settlement.risk.identity;

import com.creator.settlement.risk.domain.DocumentType;
import com.creator.settlement.risk.domain.DocumentValidation;

/**
 * CPF/CNPJ check-digit validation. Formatting characters are ignored; sequences of one
 * repeated digit are rejected even though their check digits add up.
 */
public final class TaxIdValidator {

    private static final int[] CNPJ_FIRST_WEIGHTS = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CNPJ_SECOND_WEIGHTS = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    private TaxIdValidator() {}

    /** Strips everything but digits. */
    public static String normalize(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    public static boolean isValidCpf(String value) {
        String digits = normalize(value);
        if (digits.length() != 11 || isRepeatedDigit(digits)) {
            return false;
        }
        int first = checkDigit(digits, 9, 10);
        int second = checkDigit(digits, 10, 11);
        return first == digitAt(digits, 9) && second == digitAt(digits, 10);
    }

    public static boolean isValidCnpj(String value) {
        String digits = normalize(value);
        if (digits.length() != 14 || isRepeatedDigit(digits)) {
            return false;
        }
        int first = weightedCheckDigit(digits, CNPJ_FIRST_WEIGHTS);
        int second = weightedCheckDigit(digits, CNPJ_SECOND_WEIGHTS);
        return first == digitAt(digits, 12) && second == digitAt(digits, 13);
    }

    /**
     * Picks CPF or CNPJ by digit count (11 or 14) and validates it.
     */
    public static DocumentValidation validate(String value) {
        String digits = normalize(value);
        if (digits.length() == 11) {
            return new DocumentValidation(isValidCpf(digits), DocumentType.CPF);
        }
        if (digits.length() == 14) {
            return new DocumentValidation(isValidCnpj(digits), DocumentType.CNPJ);
        }
        return DocumentValidation.invalid(null);
    }

    // CPF weights run from startWeight down to 2 over the first `length` digits
    private static int checkDigit(String digits, int length, int startWeight) {
        int sum = 0;
        for (int i = 0; i < length; i++) {
            sum += digitAt(digits, i) * (startWeight - i);
        }
        return toCheckDigit(sum);
    }

    private static int weightedCheckDigit(String digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += digitAt(digits, i) * weights[i];
        }
        return toCheckDigit(sum);
    }

    private static int toCheckDigit(int sum) {
        int remainder = sum % 11;
        return remainder < 2 ? 0 : 11 - remainder;
    }

    private static boolean isRepeatedDigit(String digits) {
        return digits.chars().allMatch(c -> c == digits.charAt(0));
    }

    private static int digitAt(String digits, int index) {
        return digits.charAt(index) - '0';
    }
}
