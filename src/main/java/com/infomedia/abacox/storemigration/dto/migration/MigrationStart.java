package com.infomedia.abacox.storemigration.dto.migration;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class MigrationStart {
    @Builder.Default
    @Schema(description = "Assemble and map without writing to the target", example = "false")
    private Boolean dryRun = false;

    @Builder.Default
    @Schema(description = "Skip customers already migrated successfully", example = "true")
    private Boolean skipAlreadyMigrated = true;

    @Min(1)
    @Schema(description = "Maximum number of customers to process, empty for all", example = "10")
    private Integer testLimit;
}
