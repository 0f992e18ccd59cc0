package com.infomedia.abacox.storemigration.component.collection;

import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CollectionResult {
    private EntityKind kind;
    private long collected;
    private long failed;
    /**
     * Page the run ended on; start the next run here to resume.
     */
    private int finalPage;
    private CollectionState state;
    private int pagesFetched;
}
