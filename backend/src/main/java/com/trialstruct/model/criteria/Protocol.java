package com.trialstruct.model.criteria;

import com.trialstruct.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Clinical trial protocol owning a set of eligibility criteria.
 */
@Entity
@Table(name = "protocol")
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Protocol extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(nullable = false, length = 500)
    private String title;
}
