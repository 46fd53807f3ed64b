package com.trialstruct.repository;

import com.trialstruct.model.criteria.AtomicCriterion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for atomic criteria (expression tree leaves).
 */
@Repository
public interface AtomicCriterionRepository extends JpaRepository<AtomicCriterion, String> {

    List<AtomicCriterion> findByCriterionIdOrderByMappingIndexAsc(String criterionId);

    List<AtomicCriterion> findByProtocolId(String protocolId);

    @Modifying
    @Query("DELETE FROM AtomicCriterion a WHERE a.criterionId = :criterionId")
    int deleteByCriterionId(@Param("criterionId") String criterionId);
}
