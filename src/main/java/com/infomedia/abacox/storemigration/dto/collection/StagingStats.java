package com.infomedia.abacox.storemigration.dto.collection;

import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Schema(description = "Staged record counts of one entity kind")
public class StagingStats {
    private EntityKind kind;
    private long count;
    @Schema(description = "Distinct customers owning the staged records, 0 for customers")
    private long distinctOwners;
}
