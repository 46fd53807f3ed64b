package com.trialstruct.model.criteria;

import com.trialstruct.model.AuditableEntity;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.EntityDomain;
import com.trialstruct.model.enums.ReviewStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Leaf condition of an expression tree: entity, operator and value/unit.
 * At most one of valueNumeric and valueText is set.
 * Negation is derived syntactically from the relation operator and is
 * independent of the owning criterion's polarity.
 */
@Entity
@Table(name = "atomic_criteria", indexes = {
    @Index(name = "idx_atomic_criterion", columnList = "criterion_id"),
    @Index(name = "idx_atomic_protocol", columnList = "protocol_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class AtomicCriterion extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "criterion_id", nullable = false, length = 255)
    private String criterionId;

    @Column(name = "protocol_id", nullable = false, length = 255)
    private String protocolId;

    @Enumerated(EnumType.STRING)
    @Column(name = "inclusion_exclusion", nullable = false, length = 20)
    private CriteriaType inclusionExclusion;

    /**
     * Position of the source field mapping within its criterion; the index space used by logic detection.
     */
    @Column(name = "mapping_index", nullable = false)
    @Builder.Default
    private Integer mappingIndex = 0;

    @Column(name = "entity_text", length = 500)
    private String entityText;

    @Column(name = "entity_concept_id", length = 100)
    private String entityConceptId;

    @Column(name = "entity_concept_system", length = 100)
    private String entityConceptSystem;

    @Column(name = "omop_concept_id", length = 100)
    private String omopConceptId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_domain", length = 30)
    private EntityDomain entityDomain;

    @Column(name = "relation_operator", length = 30)
    private String relationOperator;

    @Column(name = "value_numeric")
    private Double valueNumeric;

    @Column(name = "value_text", columnDefinition = "TEXT")
    private String valueText;

    @Column(name = "unit_text", length = 100)
    private String unitText;

    @Column(name = "unit_concept_id")
    private Integer unitConceptId;

    @Column(name = "value_concept_id")
    private Integer valueConceptId;

    @Column(nullable = false)
    @Builder.Default
    private boolean negation = false;

    @Column(name = "original_text", columnDefinition = "TEXT")
    private String originalText;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", length = 30)
    private ReviewStatus reviewStatus;
}
