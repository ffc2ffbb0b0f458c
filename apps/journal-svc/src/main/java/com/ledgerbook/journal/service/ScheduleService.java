package com.ledgerbook.journal.service;

import com.ledgerbook.journal.model.FixedAsset;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Loan;
import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import com.ledgerbook.journal.repository.RecordNotFoundException;
import com.ledgerbook.journal.schedule.AmortizationSchedule;
import com.ledgerbook.journal.schedule.AmortizationScheduleGenerator;
import com.ledgerbook.journal.schedule.DepreciationScheduleGenerator;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class ScheduleService {

    private final LedgerSnapshotRepository repository;

    public ScheduleService(LedgerSnapshotRepository repository) {
        this.repository = repository;
    }

    public DepreciationView depreciation(long assetId) {
        FixedAsset asset = repository.current().findFixedAsset(assetId)
                .orElseThrow(() -> new RecordNotFoundException("Fixed asset", assetId));
        return new DepreciationView(asset, DepreciationScheduleGenerator.generate(asset));
    }

    public AmortizationView amortization(long loanId) {
        LedgerSnapshot snapshot = repository.current();
        Loan loan = snapshot.findLoan(loanId)
                .orElseThrow(() -> new RecordNotFoundException("Loan", loanId));
        return new AmortizationView(loan, AmortizationScheduleGenerator.generate(loan, snapshot.skippedPaymentNumbers(loanId)));
    }

    public record DepreciationView(FixedAsset asset, Map<YearMonth, BigDecimal> schedule) {
    }

    public record AmortizationView(Loan loan, AmortizationSchedule schedule) {
    }
}
