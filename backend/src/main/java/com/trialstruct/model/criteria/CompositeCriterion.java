package com.trialstruct.model.criteria;

import com.trialstruct.model.AuditableEntity;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.enums.LogicalOperator;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Branch node (AND/OR/NOT) of an expression tree.
 * Self-referencing for nested operators; the root carries the criterion text.
 */
@Entity
@Table(name = "composite_criteria", indexes = {
    @Index(name = "idx_composite_criterion", columnList = "criterion_id"),
    @Index(name = "idx_composite_protocol", columnList = "protocol_id"),
    @Index(name = "idx_composite_parent", columnList = "parent_composite_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class CompositeCriterion extends AuditableEntity {

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

    @Enumerated(EnumType.STRING)
    @Column(name = "logic_operator", nullable = false, length = 10)
    private LogicalOperator logicOperator;

    /**
     * NULL for the root of a criterion's tree.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_composite_id")
    private CompositeCriterion parentComposite;

    @Column(name = "original_text", columnDefinition = "TEXT")
    private String originalText;
}
