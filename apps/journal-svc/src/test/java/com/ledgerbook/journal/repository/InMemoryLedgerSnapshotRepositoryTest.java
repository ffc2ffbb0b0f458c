package com.ledgerbook.journal.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgerbook.journal.LedgerFixtures;
import com.ledgerbook.journal.model.LedgerSnapshot;
import java.math.BigDecimal;
import java.time.YearMonth;
import org.junit.jupiter.api.Test;

class InMemoryLedgerSnapshotRepositoryTest {

    private final InMemoryLedgerSnapshotRepository repository = new InMemoryLedgerSnapshotRepository();

    @Test
    void startsEmptyAtVersionZero() {
        assertThat(repository.current().version()).isZero();
        assertThat(repository.current().transactions()).isEmpty();
    }

    @Test
    void replaceBumpsVersion() {
        LedgerSnapshot stored = repository.replace(LedgerFixtures.balancedLedger(), 0);

        assertThat(stored.version()).isEqualTo(1);
        assertThat(repository.current().transactions()).hasSize(9);
    }

    @Test
    void staleBaseVersionIsRejected() {
        repository.replace(LedgerFixtures.balancedLedger(), 0);

        assertThatThrownBy(() -> repository.replace(LedgerSnapshot.empty(), 0))
                .isInstanceOf(SnapshotVersionConflictException.class)
                .satisfies(ex -> {
                    SnapshotVersionConflictException conflict = (SnapshotVersionConflictException) ex;
                    assertThat(conflict.expectedVersion()).isZero();
                    assertThat(conflict.actualVersion()).isEqualTo(1);
                });
        assertThat(repository.current().transactions()).hasSize(9);
    }

    @Test
    void overridesAreSetAndClearedIndependently() {
        YearMonth march = YearMonth.of(2024, 3);
        LedgerSnapshot before = repository.current();

        repository.setPlOverride(1, march, new BigDecimal("12.345"));
        LedgerSnapshot afterCash = repository.setCashFlowOverride(1, march, new BigDecimal("7"));

        assertThat(afterCash.plOverrides().find(1, march)).contains(new BigDecimal("12.35"));
        assertThat(afterCash.cashFlowOverrides().find(1, march)).contains(new BigDecimal("7.00"));
        assertThat(afterCash.version()).isEqualTo(2);

        LedgerSnapshot cleared = repository.setPlOverride(1, march, null);
        assertThat(cleared.plOverrides().isEmpty()).isTrue();
        assertThat(cleared.cashFlowOverrides().size()).isEqualTo(1);
        // earlier readers keep the snapshot they were handed
        assertThat(before.plOverrides().isEmpty()).isTrue();
        assertThat(before.version()).isZero();
    }
}
