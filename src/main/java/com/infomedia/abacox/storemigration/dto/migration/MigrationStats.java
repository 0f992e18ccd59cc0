package com.infomedia.abacox.storemigration.dto.migration;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Recorded migration outcomes")
public class MigrationStats {
    private boolean trackingAvailable;
    private long customersSucceeded;
    private long customersFailed;
    private long customersPending;
    private long ordersSucceeded;
    private long ordersFailed;
}
