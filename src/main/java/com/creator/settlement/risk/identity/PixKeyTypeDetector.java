package com.creator.settlement.risk.identity;

import com.creator.settlement.domain.PixKeyType;

import java.util.regex.Pattern;

/**
 * Infers the PIX key type when the creator record does not store one. Unrecognized keys are
 * sent as random keys (EVP) and left for the gateway to reject.
 */
public final class PixKeyTypeDetector {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern EVP = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?55\\d{10,11}$");

    private PixKeyTypeDetector() {}

    public static PixKeyType detect(String pixKey) {
        if (pixKey == null || pixKey.isBlank()) {
            return PixKeyType.EVP;
        }
        String key = pixKey.trim();
        if (EMAIL.matcher(key).matches()) {
            return PixKeyType.EMAIL;
        }
        if (EVP.matcher(key).matches()) {
            return PixKeyType.EVP;
        }
        String compact = key.replaceAll("[\\s().-]", "");
        if (PHONE.matcher(compact).matches()) {
            return PixKeyType.PHONE;
        }
        String digits = TaxIdValidator.normalize(key);
        if (digits.length() == 14 && !key.startsWith("+")) {
            return PixKeyType.CNPJ;
        }
        if (digits.length() == 11 && !key.startsWith("+")) {
            // An 11-digit key is a CPF when its check digits add up, otherwise a mobile number
            return TaxIdValidator.isValidCpf(digits) ? PixKeyType.CPF : PixKeyType.PHONE;
        }
        if (digits.length() == 10 && digits.equals(compact)) {
            return PixKeyType.PHONE;
        }
        return PixKeyType.EVP;
    }

    /** The stored type when present, otherwise the detected one. */
    public static PixKeyType resolve(String pixKey, PixKeyType storedType) {
        return storedType != null ? storedType : detect(pixKey);
    }
}
