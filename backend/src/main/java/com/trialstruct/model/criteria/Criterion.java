package com.trialstruct.model.criteria;

import com.trialstruct.model.AuditableEntity;
import com.trialstruct.model.enums.CriteriaType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * A single eligibility criterion as extracted from a protocol.
 * Holds the grounded field mappings it was structured from and,
 * once structuring succeeds, the JSON form of its expression tree.
 */
@Entity
@Table(name = "criteria", indexes = {
    @Index(name = "idx_criteria_protocol", columnList = "protocol_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Criterion extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "protocol_id", nullable = false, length = 255)
    private String protocolId;

    @Enumerated(EnumType.STRING)
    @Column(name = "criteria_type", nullable = false, length = 20)
    @Builder.Default
    private CriteriaType criteriaType = CriteriaType.INCLUSION;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    /**
     * JSON array of field mappings (entity, relation, value, unit, codes).
     */
    @Column(name = "field_mappings", columnDefinition = "TEXT")
    private String fieldMappings;

    /**
     * JSON StructuredCriterionTree. NULL until structuring has run.
     */
    @Column(name = "structured_criterion", columnDefinition = "TEXT")
    private String structuredCriterion;

    @Column(name = "display_order", nullable = false)
    @Builder.Default
    private Integer displayOrder = 0;
}
