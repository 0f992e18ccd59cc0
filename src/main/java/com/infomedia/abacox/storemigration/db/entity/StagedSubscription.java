package com.infomedia.abacox.storemigration.db.entity;

import com.infomedia.abacox.storemigration.db.entity.superclass.OwnedStagedEntity;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(
    name = "staged_subscription",
    indexes = {
        @Index(name = "idx_staged_subscription_owner", columnList = "owner_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
public class StagedSubscription extends OwnedStagedEntity {
}
