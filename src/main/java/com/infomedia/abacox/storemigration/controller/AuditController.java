package com.infomedia.abacox.storemigration.controller;

import com.infomedia.abacox.storemigration.component.audit.DensityBucket;
import com.infomedia.abacox.storemigration.component.audit.PageAuditReport;
import com.infomedia.abacox.storemigration.component.audit.RangeAuditReport;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.audit.ExportResponse;
import com.infomedia.abacox.storemigration.dto.audit.IdGapReport;
import com.infomedia.abacox.storemigration.service.AuditService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Validated
@Tag(name = "Audit", description = "Staging audit API")
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;

    @GetMapping(value = "/{kind}/page/{page}", produces = MediaType.APPLICATION_JSON_VALUE)
    public PageAuditReport auditPage(@PathVariable String kind,
                                     @PathVariable @Min(0) int page,
                                     @RequestParam(defaultValue = "1000") @Min(1) @Max(1000) int pageSize) {
        return auditService.auditPage(EntityKind.fromPathValue(kind), page, pageSize);
    }

    @GetMapping(value = "/{kind}/range", produces = MediaType.APPLICATION_JSON_VALUE)
    public RangeAuditReport auditRange(@PathVariable String kind,
                                       @RequestParam @Min(0) int startPage,
                                       @RequestParam @Min(0) int endPage,
                                       @RequestParam(defaultValue = "1000") @Min(1) @Max(1000) int pageSize) {
        return auditService.auditRange(EntityKind.fromPathValue(kind), startPage, endPage, pageSize);
    }

    @PostMapping(value = "/{kind}/range/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ExportResponse exportRangeAudit(@PathVariable String kind,
                                           @RequestParam @Min(0) int startPage,
                                           @RequestParam @Min(0) int endPage,
                                           @RequestParam(defaultValue = "1000") @Min(1) @Max(1000) int pageSize) {
        return auditService.auditRangeAndExport(EntityKind.fromPathValue(kind), startPage, endPage, pageSize);
    }

    @GetMapping(value = "/{kind}/density", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DensityBucket> densityOverview(@PathVariable String kind,
                                               @RequestParam(defaultValue = "1000") @Min(1) int pageSize,
                                               @RequestParam(defaultValue = "10") @Min(1) int pagesPerChunk) {
        return auditService.densityOverview(EntityKind.fromPathValue(kind), pageSize, pagesPerChunk);
    }

    @GetMapping(value = "/{kind}/gaps", produces = MediaType.APPLICATION_JSON_VALUE)
    public IdGapReport findIdGaps(@PathVariable String kind,
                                  @RequestParam @Min(1) long startId,
                                  @RequestParam @Min(1) long endId) {
        return auditService.findIdGaps(EntityKind.fromPathValue(kind), startId, endId);
    }
}
