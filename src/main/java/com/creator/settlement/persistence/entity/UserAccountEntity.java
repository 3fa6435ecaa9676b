package com.creator.settlement.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Platform user as seen by the identity checks. Only the tax id is relevant here.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_cpf_cnpj", columnList = "cpf_cnpj")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccountEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "cpf_cnpj", length = 20)
    private String cpfCnpj;
}
