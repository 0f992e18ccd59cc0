package com.infomedia.abacox.storemigration.component.sourceapi;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One page of a source listing endpoint.
 */
@Data
@Builder
@AllArgsConstructor
public class SourcePage {
    /**
     * Raw elements of {@code results}; not every element is guaranteed to be a usable record.
     */
    private List<JsonNode> results;
    /**
     * Cursor URL of the next page, null on the last page.
     */
    private String next;
    /**
     * Total number of records the source reports, when present.
     */
    private Long count;

    public boolean isEmpty() {
        return results == null || results.isEmpty();
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
