package com.infomedia.abacox.storemigration.component.migration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderOutcome {
    private long sourceOrderId;
    private Long targetOrderId;
    private MigrationStatus status;
    private String error;
}
