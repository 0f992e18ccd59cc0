package com.infomedia.abacox.storemigration.db.entity.superclass;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

/**
 * Raw source record kept verbatim for later re-mapping. Keyed by the source system's own id,
 * so a second collection pass overwrites instead of duplicating.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public abstract class StagedEntity {

    /**
     * Identifier assigned by the source platform.
     */
    @Id
    @Column(name = "natural_id", nullable = false)
    private Long naturalId;

    /**
     * Full JSON document as returned by the source API.
     */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    /**
     * Time of the last successful write of this row.
     */
    @Column(name = "fetched_at", nullable = false)
    private LocalDateTime fetchedAt;
}
