package com.infomedia.abacox.storemigration.component.staging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.OptionalLong;

/**
 * One source record on its way into (or out of) the staging store. The payload stays an opaque
 * JSON document; only the natural id and the owner id are lifted into typed fields.
 */
@Data
@Builder
@AllArgsConstructor
public class StagingRecord {
    private long naturalId;
    private Long ownerId;
    private ObjectNode payload;
    private LocalDateTime fetchedAt;

    /**
     * Builds a record from one element of a source page.
     *
     * @throws InvalidRecordException when the element is not an object or has no usable natural id
     */
    public static StagingRecord fromSource(EntityKind kind, JsonNode node, LocalDateTime fetchedAt) {
        if (node == null || !node.isObject()) {
            throw new InvalidRecordException("Expected a JSON object but got "
                    + (node == null ? "null" : node.getNodeType()));
        }
        OptionalLong naturalId = kind.naturalId(node);
        if (naturalId.isEmpty()) {
            throw new InvalidRecordException("Record has no usable '" + EntityKind.ID_FIELD + "' field");
        }
        OptionalLong ownerId = kind.ownerId(node);
        return StagingRecord.builder()
                .naturalId(naturalId.getAsLong())
                .ownerId(ownerId.isPresent() ? ownerId.getAsLong() : null)
                .payload((ObjectNode) node)
                .fetchedAt(fetchedAt)
                .build();
    }
}
