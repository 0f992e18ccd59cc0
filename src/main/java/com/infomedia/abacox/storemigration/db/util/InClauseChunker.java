package com.infomedia.abacox.storemigration.db.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Splits id lookups into IN clauses the backend accepts. SQLite stops at 999 bound parameters,
 * SQL Server at 2100; the result is the union of the per-chunk results, so callers may pass
 * id sets of any size.
 */
public final class InClauseChunker {

    public static final int DEFAULT_CHUNK_SIZE = 999;

    private InClauseChunker() {
    }

    public static <R> List<R> queryInChunks(Collection<Long> ids, int chunkSize,
                                            Function<List<Long>, ? extends Collection<? extends R>> query) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1: " + chunkSize);
        }
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        List<Long> distinctIds = ids.stream().filter(Objects::nonNull).distinct().collect(Collectors.toList());
        List<R> results = new ArrayList<>();
        for (int i = 0; i < distinctIds.size(); i += chunkSize) {
            List<Long> chunk = distinctIds.subList(i, Math.min(i + chunkSize, distinctIds.size()));
            results.addAll(query.apply(List.copyOf(chunk)));
        }
        return results;
    }
}
