package com.trialstruct.repository;

import com.trialstruct.model.criteria.Criterion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for eligibility criteria.
 */
@Repository
public interface CriterionRepository extends JpaRepository<Criterion, String> {

    /**
     * Find a protocol's criteria in display order.
     */
    List<Criterion> findByProtocolIdOrderByDisplayOrderAscIdAsc(String protocolId);

    List<Criterion> findByProtocolIdAndIdInOrderByDisplayOrderAscIdAsc(String protocolId, Collection<String> ids);
}
