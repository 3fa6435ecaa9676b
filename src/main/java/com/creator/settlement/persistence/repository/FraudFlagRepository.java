package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.FraudFlagEntity;
import com.creator.settlement.risk.domain.FraudFlagType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface FraudFlagRepository extends JpaRepository<FraudFlagEntity, String> {

    @Query(value = "SELECT f FROM FraudFlagEntity f "
            + "WHERE (:resolved IS NULL OR f.resolved = :resolved) AND (:type IS NULL OR f.type = :type) "
            + "ORDER BY f.severity DESC, f.createdAt DESC",
            countQuery = "SELECT COUNT(f) FROM FraudFlagEntity f "
            + "WHERE (:resolved IS NULL OR f.resolved = :resolved) AND (:type IS NULL OR f.type = :type)")
    Page<FraudFlagEntity> search(@Param("resolved") Boolean resolved,
                                 @Param("type") FraudFlagType type,
                                 Pageable pageable);

    long countByResolvedFalse();
}
