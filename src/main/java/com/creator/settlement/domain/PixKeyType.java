package com.creator.settlement.domain;

/**
 * PIX key kinds accepted by the settlement gateway. EVP is the random (UUID) key.
 */
public enum PixKeyType {
    CPF,
    CNPJ,
    EMAIL,
    PHONE,
    EVP
}
