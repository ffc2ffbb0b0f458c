package com.ledgerbook.journal.repository;

import com.ledgerbook.journal.model.LedgerSnapshot;
import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Source of the record snapshot a statement pass reads. Every call returns an immutable snapshot;
 * writers replace it wholesale.
 */
public interface LedgerSnapshotRepository {

    LedgerSnapshot current();

    /**
     * Replace all records. {@code baseVersion} must match the stored version, otherwise a
     * {@link SnapshotVersionConflictException} is thrown and nothing changes.
     *
     * @return the stored snapshot carrying its new version
     */
    LedgerSnapshot replace(LedgerSnapshot snapshot, long baseVersion);

    /** Set a Profit &amp; Loss override; a {@code null} amount removes it. */
    LedgerSnapshot setPlOverride(long categoryId, YearMonth month, BigDecimal amount);

    /** Set a Cash Flow override; a {@code null} amount removes it. */
    LedgerSnapshot setCashFlowOverride(long categoryId, YearMonth month, BigDecimal amount);
}
