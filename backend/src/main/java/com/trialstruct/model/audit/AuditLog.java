package com.trialstruct.model.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Append-only record of a pipeline event, such as a finished structure batch.
 */
@Entity
@Table(name = "audit_log", indexes = {
    @Index(name = "idx_audit_target", columnList = "target_type, target_id"),
    @Index(name = "idx_audit_event", columnList = "event_type")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    public static final String STRUCTURE_TREES_BUILT = "structure_trees_built";

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "actor_id", length = 100)
    private String actorId;

    @Column(name = "target_type", length = 50)
    private String targetType;

    @Column(name = "target_id", length = 255)
    private String targetId;

    /**
     * Event details (stored as JSON since the shape varies by event type).
     */
    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(nullable = false)
    private LocalDateTime timestamp;
}
