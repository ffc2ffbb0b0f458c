package com.ledgerbook.journal.repository;

import com.ledgerbook.journal.model.LedgerSnapshot;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryLedgerSnapshotRepository implements LedgerSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerSnapshotRepository.class);

    private final AtomicReference<LedgerSnapshot> storage = new AtomicReference<>(LedgerSnapshot.empty());

    @Override
    public LedgerSnapshot current() {
        return storage.get();
    }

    @Override
    public LedgerSnapshot replace(LedgerSnapshot snapshot, long baseVersion) {
        LedgerSnapshot existing = storage.get();
        if (existing.version() != baseVersion) {
            throw new SnapshotVersionConflictException(baseVersion, existing.version());
        }
        LedgerSnapshot next = snapshot.withVersion(baseVersion + 1);
        if (!storage.compareAndSet(existing, next)) {
            throw new SnapshotVersionConflictException(baseVersion, storage.get().version());
        }
        log.info("Ledger snapshot replaced: version={}, transactions={}, categories={}, assets={}, loans={}",
                next.version(), next.transactions().size(), next.categories().size(),
                next.fixedAssets().size(), next.loans().size());
        return next;
    }

    @Override
    public LedgerSnapshot setPlOverride(long categoryId, YearMonth month, BigDecimal amount) {
        return update(snapshot -> snapshot.withPlOverrides(
                snapshot.plOverrides().with(categoryId, month, amount)));
    }

    @Override
    public LedgerSnapshot setCashFlowOverride(long categoryId, YearMonth month, BigDecimal amount) {
        return update(snapshot -> snapshot.withCashFlowOverrides(
                snapshot.cashFlowOverrides().with(categoryId, month, amount)));
    }

    private LedgerSnapshot update(UnaryOperator<LedgerSnapshot> change) {
        return storage.updateAndGet(snapshot -> {
            LedgerSnapshot changed = change.apply(snapshot);
            return changed.withVersion(snapshot.version() + 1);
        });
    }
}
