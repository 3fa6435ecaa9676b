package com.creator.settlement.risk.domain;

/** Brazilian tax id kind: individual (CPF) or company (CNPJ). */
public enum DocumentType {
    CPF,
    CNPJ
}
