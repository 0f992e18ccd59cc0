package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A source record with no staged counterpart, with enough detail to prioritize a repair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MissingRecord {
    private Long id;
    private String label;
    /**
     * Serialized payload size in bytes.
     */
    private int size;
    private boolean hasId;
}
