package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.aggregate.LedgerSummary;
import com.ledgerbook.journal.controller.dto.StatementResponseDto;
import com.ledgerbook.journal.model.TaxMode;
import com.ledgerbook.journal.service.StatementService;
import com.ledgerbook.journal.statement.BalanceSheet;
import com.ledgerbook.journal.statement.CashFlowStatement;
import com.ledgerbook.journal.statement.ProfitAndLoss;
import com.ledgerbook.journal.util.Months;
import com.ledgerbook.journal.web.RequestContextHolder;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/statements")
public class StatementsController {

    private final StatementService statementService;

    public StatementsController(StatementService statementService) {
        this.statementService = statementService;
    }

    @GetMapping("/profit-and-loss")
    public ResponseEntity<StatementResponseDto<ProfitAndLoss>> profitAndLoss(
            @RequestParam(value = "currentMonth", required = false) String currentMonth,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "taxMode", required = false) String taxMode
    ) {
        var statement = statementService.profitAndLoss(
                Months.parseOptional(currentMonth),
                Months.parseOptional(from),
                Months.parseOptional(to),
                taxMode(taxMode));
        return ResponseEntity.ok(wrap(statement));
    }

    @GetMapping("/cash-flow")
    public ResponseEntity<StatementResponseDto<CashFlowStatement>> cashFlow(
            @RequestParam(value = "currentMonth", required = false) String currentMonth,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to
    ) {
        var statement = statementService.cashFlow(
                Months.parseOptional(currentMonth),
                Months.parseOptional(from),
                Months.parseOptional(to));
        return ResponseEntity.ok(wrap(statement));
    }

    @GetMapping("/balance-sheet")
    public ResponseEntity<StatementResponseDto<BalanceSheet>> balanceSheet(
            @RequestParam(value = "asOf", required = false) String asOf,
            @RequestParam(value = "currentMonth", required = false) String currentMonth,
            @RequestParam(value = "taxMode", required = false) String taxMode
    ) {
        var sheet = statementService.balanceSheet(
                Months.parseOptional(asOf),
                Months.parseOptional(currentMonth),
                taxMode(taxMode));
        return ResponseEntity.ok(wrap(sheet));
    }

    @GetMapping("/summary")
    public ResponseEntity<StatementResponseDto<LedgerSummary>> summary() {
        return ResponseEntity.ok(wrap(statementService.summary()));
    }

    private static Optional<TaxMode> taxMode(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank()).map(TaxMode::fromValue);
    }

    private static <T> StatementResponseDto<T> wrap(T statement) {
        var context = RequestContextHolder.get();
        return new StatementResponseDto<>(
                statement,
                context.map(RequestContextHolder.RequestContext::snapshotVersion).orElse(null),
                context.map(RequestContextHolder.RequestContext::traceId).orElse(null));
    }
}
