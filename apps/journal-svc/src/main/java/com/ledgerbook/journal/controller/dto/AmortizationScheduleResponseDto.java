package com.ledgerbook.journal.controller.dto;

import com.ledgerbook.journal.schedule.AmortizationEntry;
import java.math.BigDecimal;
import java.util.List;

public record AmortizationScheduleResponseDto(
        long loanId,
        String name,
        BigDecimal principal,
        BigDecimal levelPayment,
        int scheduledPayments,
        BigDecimal totalInterest,
        BigDecimal interestPaid,
        BigDecimal finalBalance,
        List<AmortizationEntry> entries
) {
}
