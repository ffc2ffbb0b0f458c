package com.ledgerbook.journal.controller.dto;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.EquityConfig;
import com.ledgerbook.journal.model.Folder;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Loan;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.model.SkippedPayment;
import com.ledgerbook.journal.model.Transaction;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LedgerSnapshotDto(
        Long version,
        List<Transaction> transactions,
        List<Category> categories,
        List<Folder> folders,
        List<FixedAssetDto> fixedAssets,
        List<Loan> loans,
        List<SkippedPayment> skippedPayments,
        List<OverrideDto> plOverrides,
        List<OverrideDto> cashFlowOverrides,
        EquityConfig equity
) {

    public static LedgerSnapshotDto from(LedgerSnapshot snapshot) {
        return new LedgerSnapshotDto(
                snapshot.version(),
                snapshot.transactions(),
                snapshot.categories(),
                snapshot.folders(),
                snapshot.fixedAssets().stream().map(FixedAssetDto::from).toList(),
                snapshot.loans(),
                snapshot.skippedPayments(),
                overrides(snapshot.plOverrides()),
                overrides(snapshot.cashFlowOverrides()),
                snapshot.equity()
        );
    }

    /** The version is assigned by the store, so the one carried here is ignored. */
    public LedgerSnapshot toModel() {
        return new LedgerSnapshot(
                0,
                transactions,
                categories,
                folders,
                fixedAssets == null ? List.of() : fixedAssets.stream().map(FixedAssetDto::toModel).toList(),
                loans,
                skippedPayments,
                overrides(plOverrides),
                overrides(cashFlowOverrides),
                equity
        );
    }

    private static List<OverrideDto> overrides(Overrides overrides) {
        return overrides.asMap().entrySet().stream()
                .map(entry -> new OverrideDto(entry.getKey().categoryId(), entry.getKey().month(), entry.getValue()))
                .sorted(Comparator.comparing(OverrideDto::month).thenComparingLong(OverrideDto::categoryId))
                .toList();
    }

    private static Overrides overrides(List<OverrideDto> entries) {
        if (entries == null || entries.isEmpty()) {
            return Overrides.empty();
        }
        Map<OverrideKey, BigDecimal> values = new LinkedHashMap<>();
        for (OverrideDto entry : entries) {
            if (entry.month() == null) {
                throw new IllegalArgumentException("override month must be provided");
            }
            values.put(new OverrideKey(entry.categoryId(), entry.month()), entry.amount());
        }
        return Overrides.of(values);
    }
}
