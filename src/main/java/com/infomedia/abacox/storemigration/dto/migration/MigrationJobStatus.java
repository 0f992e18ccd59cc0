package com.infomedia.abacox.storemigration.dto.migration;

import com.infomedia.abacox.storemigration.component.migration.MigrationRunResult;
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
public class MigrationJobStatus {
    private JobState state;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String errorMessage;
    private Map<String, Object> progress;
    private MigrationRunResult result;
}
