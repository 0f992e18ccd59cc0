package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
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
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageAuditReport {
    private EntityKind kind;
    private int page;
    private int apiCount;
    private int dbCount;
    private int presentCount;
    private int mismatchCount;
    /**
     * Complete count of missing records; {@link #missingRecords} may be truncated.
     */
    private int missingCount;
    @Builder.Default
    private List<MissingRecord> missingRecords = new ArrayList<>();
    @Builder.Default
    private List<DataIssue> dataIssues = new ArrayList<>();
    /**
     * Set when the page could not be fetched; the other fields are then empty.
     */
    private String error;
}
