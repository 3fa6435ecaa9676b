package com.creator.settlement.compliance;

/**
 * Redacts PIX keys and tax ids so they are safe to include in logs.
 * Keeps just enough of the value to tell two keys apart while debugging.
 */
public final class SensitiveDataMasker {

    private SensitiveDataMasker() {}

    /** Returns the digits with all but the last 4 masked (e.g. "111.444.777-35" -> "*******7735"). */
    public static String maskTaxId(String cpfCnpj) {
        if (cpfCnpj == null || cpfCnpj.isBlank()) return null;
        String digits = cpfCnpj.replaceAll("\\D", "");
        if (digits.length() <= 4) return "****";
        return "*".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
    }

    /** Emails keep the first character and the domain; other keys keep their last 4 characters. */
    public static String maskPixKey(String pixKey) {
        if (pixKey == null || pixKey.isBlank()) return null;
        int at = pixKey.indexOf('@');
        if (at > 0) {
            return pixKey.charAt(0) + "***" + pixKey.substring(at);
        }
        if (pixKey.length() <= 4) return "****";
        return "***" + pixKey.substring(pixKey.length() - 4);
    }

    /** Fingerprints are not secrets but are long; keep a short prefix for correlation. */
    public static String shortFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.length() <= 12) return fingerprint;
        return fingerprint.substring(0, 12) + "...";
    }
}
