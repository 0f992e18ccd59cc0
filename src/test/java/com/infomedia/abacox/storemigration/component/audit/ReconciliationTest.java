package com.infomedia.abacox.storemigration.component.audit;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationTest {

    @Test
    void missingAndExtraAreDisjointAndCoverTheDifference() {
        Reconciliation reconciliation = Reconciliation.of(List.of(1L, 2L, 3L, 4L), List.of(3L, 4L, 5L));

        assertThat(reconciliation.getMissing()).containsExactly(1L, 2L);
        assertThat(reconciliation.getExtra()).containsExactly(5L);

        Set<Long> rebuilt = new TreeSet<>(reconciliation.getMissing());
        rebuilt.addAll(List.of(3L, 4L));
        assertThat(rebuilt).isEqualTo(reconciliation.getExpectedIds());
        assertThat(reconciliation.isClean()).isFalse();
    }

    @Test
    void identicalSetsAreClean() {
        Reconciliation reconciliation = Reconciliation.of(List.of(7L, 8L), Set.of(8L, 7L));

        assertThat(reconciliation.isClean()).isTrue();
        assertThat(reconciliation.getMissing()).isEmpty();
        assertThat(reconciliation.getExtra()).isEmpty();
    }

    @Test
    void nullInputsAreTreatedAsEmpty() {
        Reconciliation reconciliation = Reconciliation.of(null, List.of(1L));

        assertThat(reconciliation.getExpectedIds()).isEmpty();
        assertThat(reconciliation.getExtra()).containsExactly(1L);
    }

    @Test
    void emptyActualSetMakesEveryExpectedIdMissing() {
        Reconciliation reconciliation = Reconciliation.of(List.of(1L, 2L), Set.of());

        assertThat(reconciliation.getMissing()).containsExactly(1L, 2L);
        assertThat(reconciliation.getExtra()).isEmpty();
        assertThat(reconciliation.isClean()).isFalse();
    }

    @Test
    void twoEmptySetsAreClean() {
        Reconciliation reconciliation = Reconciliation.of(Set.of(), Set.of());

        assertThat(reconciliation.getMissing()).isEmpty();
        assertThat(reconciliation.getExtra()).isEmpty();
        assertThat(reconciliation.isClean()).isTrue();
    }
}
