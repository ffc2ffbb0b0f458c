package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.controller.dto.AmortizationScheduleResponseDto;
import com.ledgerbook.journal.controller.dto.DepreciationScheduleResponseDto;
import com.ledgerbook.journal.controller.dto.DepreciationScheduleResponseDto.MonthAmountDto;
import com.ledgerbook.journal.service.ScheduleService;
import com.ledgerbook.journal.util.Money;
import com.ledgerbook.journal.util.Months;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schedules")
public class SchedulesController {

    private final ScheduleService scheduleService;

    public SchedulesController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping("/assets/{assetId}/depreciation")
    public ResponseEntity<DepreciationScheduleResponseDto> depreciation(@PathVariable("assetId") long assetId) {
        var view = scheduleService.depreciation(assetId);
        var asset = view.asset();
        var entries = view.schedule().entrySet().stream()
                .map(entry -> new MonthAmountDto(Months.format(entry.getKey()), entry.getValue()))
                .toList();
        return ResponseEntity.ok(new DepreciationScheduleResponseDto(
                asset.id(),
                asset.name(),
                asset.depreciationMethod().name(),
                asset.depreciableBase(),
                Money.sum(view.schedule().values()),
                entries));
    }

    @GetMapping("/loans/{loanId}/amortization")
    public ResponseEntity<AmortizationScheduleResponseDto> amortization(@PathVariable("loanId") long loanId) {
        var view = scheduleService.amortization(loanId);
        var schedule = view.schedule();
        return ResponseEntity.ok(new AmortizationScheduleResponseDto(
                view.loan().id(),
                view.loan().name(),
                schedule.principal(),
                schedule.levelPayment(),
                schedule.scheduledPayments(),
                schedule.totalInterest(),
                schedule.interestPaid(),
                schedule.finalBalance(),
                schedule.entries()));
    }
}
