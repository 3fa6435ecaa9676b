package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.UserAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccountEntity, String> {

    Optional<UserAccountEntity> findFirstByCpfCnpjIn(Collection<String> cpfCnpj);

    Optional<UserAccountEntity> findFirstByCpfCnpjInAndIdNot(Collection<String> cpfCnpj, String id);
}
