package com.trialstruct.repository;

import com.trialstruct.model.criteria.CriterionRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for parent-to-child edges between tree nodes.
 */
@Repository
public interface CriterionRelationshipRepository extends JpaRepository<CriterionRelationship, String> {

    List<CriterionRelationship> findByParentCompositeIdOrderByChildSequenceAsc(String parentCompositeId);

    @Query("SELECT r FROM CriterionRelationship r WHERE r.parentComposite.protocolId = :protocolId")
    List<CriterionRelationship> findByProtocolId(@Param("protocolId") String protocolId);

    @Modifying
    @Query("DELETE FROM CriterionRelationship r WHERE r.parentComposite.id IN " +
           "(SELECT c.id FROM CompositeCriterion c WHERE c.criterionId = :criterionId)")
    int deleteByCriterionId(@Param("criterionId") String criterionId);
}
