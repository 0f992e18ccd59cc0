package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Staged record count over one window of ids. A strongly negative {@code delta} points at a
 * region worth a range audit; it is a locality hint, not proof of loss, since source ids need
 * not be contiguous.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DensityBucket {
    /**
     * Estimated source pages covered by the window, e.g. "10-19".
     */
    private String pageRange;
    /**
     * First and last staged id in the window, null when the window is empty.
     */
    private Long firstId;
    private Long lastId;
    private long windowStartId;
    private long windowEndId;
    private long observedCount;
    private long expectedCount;
    private long delta;
}
