package com.infomedia.abacox.storemigration.dto.audit;

import com.infomedia.abacox.storemigration.component.audit.RangeAuditReport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExportResponse {
    private String file;
    private RangeAuditReport report;
}
