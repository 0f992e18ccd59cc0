package com.infomedia.abacox.storemigration.dto.collection;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional overrides for a collection run; unset fields fall back to the configured defaults.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CollectionStart {
    @Min(0)
    @Schema(description = "Page to start from, use the final page of a previous run to resume", example = "0")
    private Integer startPage;

    @Min(1)
    @Max(1000)
    @Schema(description = "Records per page", example = "1000")
    private Integer pageSize;

    @Min(0)
    @Schema(description = "Pause between pages in milliseconds", example = "200")
    private Long pauseBetweenPagesMillis;
}
