package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.controller.dto.OverrideRequestDto;
import com.ledgerbook.journal.controller.dto.OverrideResponseDto;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.service.LedgerService;
import com.ledgerbook.journal.util.Months;
import jakarta.validation.Valid;
import java.time.YearMonth;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/overrides")
public class OverridesController {

    private final LedgerService ledgerService;

    public OverridesController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PutMapping("/profit-and-loss/{categoryId}/{month}")
    public ResponseEntity<OverrideResponseDto> setPlOverride(
            @PathVariable("categoryId") long categoryId,
            @PathVariable("month") String month,
            @RequestBody @Valid OverrideRequestDto request
    ) {
        YearMonth parsed = Months.parse(month);
        var updated = ledgerService.setPlOverride(categoryId, parsed, request.amount());
        return ResponseEntity.ok(response(categoryId, parsed, updated.plOverrides(), updated));
    }

    @DeleteMapping("/profit-and-loss/{categoryId}/{month}")
    public ResponseEntity<OverrideResponseDto> clearPlOverride(
            @PathVariable("categoryId") long categoryId,
            @PathVariable("month") String month
    ) {
        YearMonth parsed = Months.parse(month);
        var updated = ledgerService.setPlOverride(categoryId, parsed, null);
        return ResponseEntity.ok(response(categoryId, parsed, updated.plOverrides(), updated));
    }

    @PutMapping("/cash-flow/{categoryId}/{month}")
    public ResponseEntity<OverrideResponseDto> setCashFlowOverride(
            @PathVariable("categoryId") long categoryId,
            @PathVariable("month") String month,
            @RequestBody @Valid OverrideRequestDto request
    ) {
        YearMonth parsed = Months.parse(month);
        var updated = ledgerService.setCashFlowOverride(categoryId, parsed, request.amount());
        return ResponseEntity.ok(response(categoryId, parsed, updated.cashFlowOverrides(), updated));
    }

    @DeleteMapping("/cash-flow/{categoryId}/{month}")
    public ResponseEntity<OverrideResponseDto> clearCashFlowOverride(
            @PathVariable("categoryId") long categoryId,
            @PathVariable("month") String month
    ) {
        YearMonth parsed = Months.parse(month);
        var updated = ledgerService.setCashFlowOverride(categoryId, parsed, null);
        return ResponseEntity.ok(response(categoryId, parsed, updated.cashFlowOverrides(), updated));
    }

    private static OverrideResponseDto response(long categoryId, YearMonth month, Overrides overrides, LedgerSnapshot snapshot) {
        return new OverrideResponseDto(categoryId, Months.format(month),
                overrides.find(categoryId, month).orElse(null), snapshot.version());
    }
}
