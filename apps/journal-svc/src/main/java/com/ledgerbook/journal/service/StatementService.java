package com.ledgerbook.journal.service;

import com.ledgerbook.journal.aggregate.LedgerSummary;
import com.ledgerbook.journal.aggregate.LedgerSummaryCalculator;
import com.ledgerbook.journal.config.JournalProperties;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.TaxMode;
import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import com.ledgerbook.journal.statement.BalanceSheet;
import com.ledgerbook.journal.statement.BalanceSheetBuilder;
import com.ledgerbook.journal.statement.CashFlowBuilder;
import com.ledgerbook.journal.statement.CashFlowStatement;
import com.ledgerbook.journal.statement.ProfitAndLoss;
import com.ledgerbook.journal.statement.ProfitAndLossBuilder;
import com.ledgerbook.journal.util.Months;
import com.ledgerbook.journal.web.RequestContextHolder;
import java.time.Clock;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the statement builders against one snapshot per request. The current month defaults to
 * the calendar month in UTC.
 */
@Service
public class StatementService {

    private static final Logger log = LoggerFactory.getLogger(StatementService.class);

    private final LedgerSnapshotRepository repository;
    private final ProfitAndLossBuilder profitAndLossBuilder;
    private final CashFlowBuilder cashFlowBuilder;
    private final BalanceSheetBuilder balanceSheetBuilder;
    private final JournalProperties properties;
    private final Clock clock;

    public StatementService(
            LedgerSnapshotRepository repository,
            ProfitAndLossBuilder profitAndLossBuilder,
            CashFlowBuilder cashFlowBuilder,
            BalanceSheetBuilder balanceSheetBuilder,
            JournalProperties properties,
            Clock clock
    ) {
        this.repository = repository;
        this.profitAndLossBuilder = profitAndLossBuilder;
        this.cashFlowBuilder = cashFlowBuilder;
        this.balanceSheetBuilder = balanceSheetBuilder;
        this.properties = properties;
        this.clock = clock;
    }

    public ProfitAndLoss profitAndLoss(Optional<YearMonth> currentMonth, Optional<YearMonth> from,
            Optional<YearMonth> to, Optional<TaxMode> taxMode) {
        LedgerSnapshot snapshot = snapshot();
        YearMonth current = currentMonth.orElseGet(this::calendarMonth);
        TaxMode mode = taxMode.orElseGet(() -> properties.statements().taxModeOrDefault());
        List<YearMonth> months = Months.span(profitAndLossBuilder.activeMonths(snapshot), from.orElse(null), to.orElse(null));
        ProfitAndLoss statement = profitAndLossBuilder.build(snapshot, months, current, mode);
        log.info("Profit and loss built: version={}, months={}, currentMonth={}, taxMode={}",
                snapshot.version(), months.size(), current, mode);
        return statement;
    }

    public CashFlowStatement cashFlow(Optional<YearMonth> currentMonth, Optional<YearMonth> from, Optional<YearMonth> to) {
        LedgerSnapshot snapshot = snapshot();
        YearMonth current = currentMonth.orElseGet(this::calendarMonth);
        List<YearMonth> months = Months.span(cashFlowBuilder.activeMonths(snapshot), from.orElse(null), to.orElse(null));
        CashFlowStatement statement = cashFlowBuilder.build(snapshot, months, current);
        log.info("Cash flow built: version={}, months={}, currentMonth={}", snapshot.version(), months.size(), current);
        return statement;
    }

    public BalanceSheet balanceSheet(Optional<YearMonth> asOf, Optional<YearMonth> currentMonth, Optional<TaxMode> taxMode) {
        LedgerSnapshot snapshot = snapshot();
        YearMonth current = currentMonth.orElseGet(this::calendarMonth);
        YearMonth asOfMonth = asOf.orElse(current);
        TaxMode mode = taxMode.orElseGet(() -> properties.statements().taxModeOrDefault());
        BalanceSheet sheet = balanceSheetBuilder.build(snapshot, asOfMonth, current, mode);
        if (sheet.balanced()) {
            log.info("Balance sheet built: version={}, asOf={}, totalAssets={}", snapshot.version(), asOfMonth, sheet.totalAssets());
        } else {
            log.warn("Balance sheet out of balance: version={}, asOf={}, difference={}",
                    snapshot.version(), asOfMonth, sheet.difference());
        }
        return sheet;
    }

    public LedgerSummary summary() {
        return LedgerSummaryCalculator.summarize(snapshot());
    }

    private LedgerSnapshot snapshot() {
        LedgerSnapshot snapshot = repository.current();
        RequestContextHolder.get()
                .ifPresent(context -> RequestContextHolder.set(context.withSnapshotVersion(snapshot.version())));
        return snapshot;
    }

    private YearMonth calendarMonth() {
        return YearMonth.now(clock);
    }
}
