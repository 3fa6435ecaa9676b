package com.creator.settlement.risk.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * A CPF or CNPJ, formatted or bare digits, and the user asking about it.
 */
@Data
public class DocumentRequestDto {

    @NotBlank(message = "cpfCnpj is required")
    private String cpfCnpj;

    /** Excluded from duplicate matches; optional for plain validation. */
    private String userId;
}
