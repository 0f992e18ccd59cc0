package com.infomedia.abacox.storemigration.component.collection;

import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CollectionParams {
    private EntityKind kind;
    @Builder.Default
    private int startPage = 0;
    @Builder.Default
    private int pageSize = 1000;
    /**
     * Progress is reported every this many processed records within a page.
     */
    @Builder.Default
    private int progressEvery = 100;
    @Builder.Default
    private int maxConsecutiveFailures = 10;
    @Builder.Default
    private long pauseBetweenPagesMillis = 200;
}
