package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RangeAuditReport {
    private EntityKind kind;
    private int startPage;
    private int endPage;
    private LocalDateTime generatedAt;
    @Builder.Default
    private List<PageAuditEntry> pagesAudited = new ArrayList<>();
    @Builder.Default
    private List<Long> missingFromDb = new ArrayList<>();
    /**
     * Staged ids outside the expected set. The lookup is restricted to expected ids, so this
     * stays empty unless the lookup contract changes.
     */
    @Builder.Default
    private List<Long> extraInDb = new ArrayList<>();
    @Builder.Default
    private List<DataIssue> dataMismatches = new ArrayList<>();
    @Builder.Default
    private List<PageAuditError> apiErrors = new ArrayList<>();
    private AuditSummary summary;
}
