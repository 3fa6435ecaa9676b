package com.creator.settlement.risk.domain;

import lombok.Value;

/**
 * Result of validating a tax id. {@code type} is null when the digit count matches neither kind.
 */
@Value
public class DocumentValidation {

    boolean valid;
    DocumentType type;

    public static DocumentValidation invalid(DocumentType type) {
        return new DocumentValidation(false, type);
    }
}
