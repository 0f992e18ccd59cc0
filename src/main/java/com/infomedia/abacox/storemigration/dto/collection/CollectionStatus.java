package com.infomedia.abacox.storemigration.dto.collection;

import com.infomedia.abacox.storemigration.component.collection.CollectionResult;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.service.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CollectionStatus {
    private EntityKind kind;
    private JobState state;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String errorMessage;
    /**
     * Last progress snapshot reported by the running collector.
     */
    private Map<String, Object> progress;
    private CollectionResult result;
}
