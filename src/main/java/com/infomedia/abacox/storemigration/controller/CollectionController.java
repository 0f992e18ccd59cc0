package com.infomedia.abacox.storemigration.controller;

import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.collection.CollectionStart;
import com.infomedia.abacox.storemigration.dto.collection.CollectionStatus;
import com.infomedia.abacox.storemigration.dto.collection.StagingStats;
import com.infomedia.abacox.storemigration.dto.generic.MessageResponse;
import com.infomedia.abacox.storemigration.service.CollectionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "Collection", description = "Source collection API")
@Log4j2
@RequestMapping("/api/collection")
public class CollectionController {

    private final CollectionJobService collectionJobService;

    @PostMapping(value = "/{kind}/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse startCollection(@PathVariable String kind,
                                           @Valid @RequestBody(required = false) CollectionStart request) {
        EntityKind entityKind = EntityKind.fromPathValue(kind);
        collectionJobService.startAsync(entityKind, request);
        return new MessageResponse("Collection of " + entityKind.name().toLowerCase()
                + " records initiated successfully. Check status endpoint for progress.");
    }

    @PostMapping(value = "/{kind}/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse stopCollection(@PathVariable String kind) {
        EntityKind entityKind = EntityKind.fromPathValue(kind);
        boolean requested = collectionJobService.stop(entityKind);
        return new MessageResponse(requested
                ? "Stop requested; the collection ends after the current page."
                : "No " + entityKind.name().toLowerCase() + " collection is running.");
    }

    @GetMapping(value = "/{kind}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public CollectionStatus getCollectionStatus(@PathVariable String kind) {
        return collectionJobService.getStatus(EntityKind.fromPathValue(kind));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<StagingStats> getStagingStats() {
        return collectionJobService.getStagingStats();
    }

    @Operation(summary = "Irreversibly deletes every staged record of a kind")
    @DeleteMapping(value = "/{kind}", produces = MediaType.APPLICATION_JSON_VALUE)
    public MessageResponse deleteStaged(@PathVariable String kind) {
        EntityKind entityKind = EntityKind.fromPathValue(kind);
        long deleted = collectionJobService.deleteStaged(entityKind);
        log.warn("Staged {} records deleted through the API: {}", entityKind, deleted);
        return new MessageResponse("Deleted " + deleted + " staged " + entityKind.name().toLowerCase() + " records.");
    }
}
