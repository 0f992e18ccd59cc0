package com.infomedia.abacox.storemigration.component.migration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MigrationParams {
    /**
     * Skip customers already recorded as migrated successfully.
     */
    @Builder.Default
    private boolean skipAlreadyMigrated = true;
    @Builder.Default
    private boolean dryRun = false;
    @Builder.Default
    private int pauseEvery = 50;
    @Builder.Default
    private long pauseMillis = 1000;
    /**
     * Maximum number of eligible customers to process; null for all.
     */
    private Integer testLimit;
}
