package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuditSummary {
    private long totalApiRecords;
    private long totalDbRecords;
    private long missingCount;
    private long extraCount;
    private long mismatchCount;
}
