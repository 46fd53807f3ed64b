package com.trialstruct.repository;

import com.trialstruct.model.criteria.CompositeCriterion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for composite criteria (AND/OR/NOT branches).
 */
@Repository
public interface CompositeCriterionRepository extends JpaRepository<CompositeCriterion, String> {

    List<CompositeCriterion> findByCriterionId(String criterionId);

    List<CompositeCriterion> findByProtocolId(String protocolId);

    /**
     * Detach parent links so a criterion's composites can be deleted in one statement.
     */
    @Modifying
    @Query("UPDATE CompositeCriterion c SET c.parentComposite = NULL WHERE c.criterionId = :criterionId")
    int clearParentsByCriterionId(@Param("criterionId") String criterionId);

    @Modifying
    @Query("DELETE FROM CompositeCriterion c WHERE c.criterionId = :criterionId")
    int deleteByCriterionId(@Param("criterionId") String criterionId);
}
