package com.infomedia.abacox.storemigration.controller;

import com.infomedia.abacox.storemigration.dto.generic.MessageResponse;
import com.infomedia.abacox.storemigration.dto.migration.MigrationJobStatus;
import com.infomedia.abacox.storemigration.dto.migration.MigrationStart;
import com.infomedia.abacox.storemigration.dto.migration.MigrationStats;
import com.infomedia.abacox.storemigration.service.MigrationJobService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@Tag(name = "Migration", description = "Migration API")
@RequestMapping("/api/migration")
public class MigrationController {

    private final MigrationJobService migrationJobService;

    @PostMapping(value = "/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse startMigration(@Valid @RequestBody(required = false) MigrationStart request) {
        migrationJobService.startAsync(request);
        return new MessageResponse("Migration process initiated successfully. Check status endpoint for progress.");
    }

    @PostMapping(value = "/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse stopMigration() {
        return new MessageResponse(migrationJobService.stop()
                ? "Stop requested; the migration ends after the current customer."
                : "No migration is running.");
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public MigrationJobStatus getMigrationStatus() {
        return migrationJobService.getStatus();
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public MigrationStats getMigrationStats() {
        return migrationJobService.getStats();
    }

    @PostMapping(value = "/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse resetMigrationStatuses() {
        long removed = migrationJobService.resetStatuses();
        return new MessageResponse("Reset " + removed + " recorded customer migration outcomes.");
    }
}
