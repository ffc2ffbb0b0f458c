package com.ledgerbook.journal.service;

import com.ledgerbook.journal.export.TransactionCsvExporter;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import com.ledgerbook.journal.repository.RecordNotFoundException;
import java.math.BigDecimal;
import java.time.YearMonth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes to the ledger snapshot: bulk record loads and single-cell overrides.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerSnapshotRepository repository;

    public LedgerService(LedgerSnapshotRepository repository) {
        this.repository = repository;
    }

    public LedgerSnapshot current() {
        return repository.current();
    }

    public LedgerSnapshot replace(LedgerSnapshot snapshot, long baseVersion) {
        return repository.replace(snapshot, baseVersion);
    }

    public LedgerSnapshot setPlOverride(long categoryId, YearMonth month, BigDecimal amount) {
        requireOverridableCategory(categoryId, true);
        LedgerSnapshot updated = repository.setPlOverride(categoryId, month, amount);
        log.info("P&L override {}: category={}, month={}, version={}",
                amount == null ? "cleared" : "set", categoryId, month, updated.version());
        return updated;
    }

    public LedgerSnapshot setCashFlowOverride(long categoryId, YearMonth month, BigDecimal amount) {
        requireOverridableCategory(categoryId, false);
        LedgerSnapshot updated = repository.setCashFlowOverride(categoryId, month, amount);
        log.info("Cash flow override {}: category={}, month={}, version={}",
                amount == null ? "cleared" : "set", categoryId, month, updated.version());
        return updated;
    }

    public String exportTransactionsCsv() {
        return TransactionCsvExporter.toCsv(repository.current());
    }

    // the income-tax row only exists on the P&L
    private void requireOverridableCategory(long categoryId, boolean incomeTaxAllowed) {
        if (incomeTaxAllowed && categoryId == Overrides.INCOME_TAX_CATEGORY_ID) {
            return;
        }
        if (repository.current().findCategory(categoryId).isEmpty()) {
            throw new RecordNotFoundException("Category", categoryId);
        }
    }
}
