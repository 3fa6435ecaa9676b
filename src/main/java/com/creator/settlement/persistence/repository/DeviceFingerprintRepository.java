package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.DeviceFingerprintEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeviceFingerprintRepository extends JpaRepository<DeviceFingerprintEntity, String> {

    Optional<DeviceFingerprintEntity> findByUserIdAndFingerprint(String userId, String fingerprint);

    Optional<DeviceFingerprintEntity> findFirstByFingerprintAndUserIdNot(String fingerprint, String userId);
}
