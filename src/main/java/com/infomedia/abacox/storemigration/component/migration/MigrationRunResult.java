package com.infomedia.abacox.storemigration.component.migration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MigrationRunResult {
    private int migrated;
    private int failed;
    private int skipped;
    private int totalProcessed;
    private int ordersMigrated;
    private int ordersFailed;
    private boolean dryRun;
    private boolean stopped;
    @Builder.Default
    private List<UnitOutcome> outcomes = new ArrayList<>();
}
