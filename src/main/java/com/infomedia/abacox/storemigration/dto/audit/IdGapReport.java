package com.infomedia.abacox.storemigration.dto.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IdGapReport {
    private EntityKind kind;
    private long startId;
    private long endId;
    private int missingCount;
    private List<Long> missingIds;
}
