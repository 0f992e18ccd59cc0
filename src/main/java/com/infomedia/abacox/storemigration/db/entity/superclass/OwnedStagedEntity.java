package com.infomedia.abacox.storemigration.db.entity.superclass;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Staged record that belongs to a customer. The owner is not a foreign key: orders may be
 * collected before their customer.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public abstract class OwnedStagedEntity extends StagedEntity {

    @Column(name = "owner_id")
    private Long ownerId;
}
