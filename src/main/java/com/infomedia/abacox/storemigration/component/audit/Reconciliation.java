package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Set comparison between the ids the source reports and the ids found in staging.
 * {@code missing} and {@code extra} are disjoint, and {@code missing} together with the
 * intersection is exactly {@code expected}.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Reconciliation {

    private final SortedSet<Long> expectedIds;
    private final SortedSet<Long> actualIds;
    private final SortedSet<Long> missing;
    private final SortedSet<Long> extra;

    private Reconciliation(SortedSet<Long> expectedIds, SortedSet<Long> actualIds,
                           SortedSet<Long> missing, SortedSet<Long> extra) {
        this.expectedIds = Collections.unmodifiableSortedSet(expectedIds);
        this.actualIds = Collections.unmodifiableSortedSet(actualIds);
        this.missing = Collections.unmodifiableSortedSet(missing);
        this.extra = Collections.unmodifiableSortedSet(extra);
    }

    public static Reconciliation of(Collection<Long> expected, Collection<Long> actual) {
        SortedSet<Long> expectedIds = expected == null ? new TreeSet<>() : new TreeSet<>(expected);
        SortedSet<Long> actualIds = actual == null ? new TreeSet<>() : new TreeSet<>(actual);

        SortedSet<Long> missing = new TreeSet<>(expectedIds);
        missing.removeAll(actualIds);
        SortedSet<Long> extra = new TreeSet<>(actualIds);
        extra.removeAll(expectedIds);
        return new Reconciliation(expectedIds, actualIds, missing, extra);
    }

    public boolean isClean() {
        return missing.isEmpty() && extra.isEmpty();
    }
}
