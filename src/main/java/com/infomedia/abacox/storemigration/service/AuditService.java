package com.infomedia.abacox.storemigration.service;

import com.infomedia.abacox.storemigration.component.audit.DensityBucket;
import com.infomedia.abacox.storemigration.component.audit.PageAuditReport;
import com.infomedia.abacox.storemigration.component.audit.RangeAuditReport;
import com.infomedia.abacox.storemigration.component.audit.StagingAuditor;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.audit.ExportResponse;
import com.infomedia.abacox.storemigration.dto.audit.IdGapReport;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Synchronous entry point for audits; runs on the calling request thread.
 */
@Service
@RequiredArgsConstructor
public class AuditService {

    private final StagingAuditor auditor;

    @Value("${store-migration.audit.export-directory:./audit-reports}")
    private String exportDirectory;

    public PageAuditReport auditPage(EntityKind kind, int page, int pageSize) {
        return auditor.auditPage(kind, page, pageSize);
    }

    public RangeAuditReport auditRange(EntityKind kind, int startPage, int endPage, int pageSize) {
        return auditor.auditRange(kind, startPage, endPage, pageSize);
    }

    public ExportResponse auditRangeAndExport(EntityKind kind, int startPage, int endPage, int pageSize) {
        RangeAuditReport report = auditor.auditRange(kind, startPage, endPage, pageSize);
        Path file = auditor.exportReport(report, Paths.get(exportDirectory));
        return new ExportResponse(file.toString(), report);
    }

    public List<DensityBucket> densityOverview(EntityKind kind, int pageSize, int pagesPerChunk) {
        return auditor.densityOverview(kind, pageSize, pagesPerChunk);
    }

    public IdGapReport findIdGaps(EntityKind kind, long startId, long endId) {
        List<Long> missing = auditor.findIdGaps(kind, startId, endId);
        return IdGapReport.builder()
                .kind(kind)
                .startId(startId)
                .endId(endId)
                .missingCount(missing.size())
                .missingIds(missing)
                .build();
    }
}
