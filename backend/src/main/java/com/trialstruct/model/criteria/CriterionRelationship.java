package com.trialstruct.model.criteria;

import com.trialstruct.model.AuditableEntity;
import com.trialstruct.model.enums.ChildKind;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Parent-to-child edge of an expression tree.
 * The child lives in either atomic_criteria or composite_criteria, so it is
 * referenced by id plus an explicit kind tag instead of a foreign key.
 * Sequence numbers are dense per parent and start at 0.
 */
@Entity
@Table(name = "criterion_relationship", indexes = {
    @Index(name = "idx_relationship_parent", columnList = "parent_composite_id"),
    @Index(name = "idx_relationship_order", columnList = "parent_composite_id, child_sequence")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class CriterionRelationship extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_composite_id", nullable = false)
    private CompositeCriterion parentComposite;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_kind", nullable = false, length = 20)
    private ChildKind childKind;

    @Column(name = "child_id", nullable = false, length = 255)
    private String childId;

    @Column(name = "child_sequence", nullable = false)
    private Integer childSequence;
}
