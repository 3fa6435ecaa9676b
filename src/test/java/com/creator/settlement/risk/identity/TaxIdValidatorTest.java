package com.creator.settlement.risk.identity;

import com.creator.settlement.risk.domain.DocumentType;
import com.creator.settlement.risk.domain.DocumentValidation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaxIdValidatorTest {

    @Test
    void acceptsValidCpfFormattedOrBare() {
        assertThat(TaxIdValidator.isValidCpf("111.444.777-35")).isTrue();
        assertThat(TaxIdValidator.isValidCpf("52998224725")).isTrue();
    }

    @Test
    void rejectsCpfWithWrongCheckDigits() {
        assertThat(TaxIdValidator.isValidCpf("111.444.777-36")).isFalse();
        assertThat(TaxIdValidator.isValidCpf("52998224724")).isFalse();
    }

    @Test
    void rejectsRepeatedDigitCpf() {
        assertThat(TaxIdValidator.isValidCpf("111.111.111-11")).isFalse();
        assertThat(TaxIdValidator.isValidCpf("00000000000")).isFalse();
    }

    @Test
    void validatesCnpjCheckDigits() {
        assertThat(TaxIdValidator.isValidCnpj("11.222.333/0001-81")).isTrue();
        assertThat(TaxIdValidator.isValidCnpj("11222333000182")).isFalse();
        assertThat(TaxIdValidator.isValidCnpj("00000000000000")).isFalse();
    }

    @Test
    void validatePicksTypeByDigitCount() {
        DocumentValidation cpf = TaxIdValidator.validate("529.982.247-25");
        assertThat(cpf.isValid()).isTrue();
        assertThat(cpf.getType()).isEqualTo(DocumentType.CPF);

        DocumentValidation cnpj = TaxIdValidator.validate("11.222.333/0001-82");
        assertThat(cnpj.isValid()).isFalse();
        assertThat(cnpj.getType()).isEqualTo(DocumentType.CNPJ);

        DocumentValidation unknown = TaxIdValidator.validate("12345");
        assertThat(unknown.isValid()).isFalse();
        assertThat(unknown.getType()).isNull();
    }

    @Test
    void normalizeKeepsDigitsOnly() {
        assertThat(TaxIdValidator.normalize(" 111.444.777-35 ")).isEqualTo("11144477735");
        assertThat(TaxIdValidator.normalize(null)).isEmpty();
    }
}
