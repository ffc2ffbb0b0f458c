package com.ledgerbook.journal.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record DepreciationScheduleResponseDto(
        long assetId,
        String name,
        String method,
        BigDecimal depreciableBase,
        BigDecimal total,
        List<MonthAmountDto> entries
) {

    public record MonthAmountDto(String month, BigDecimal amount) {
    }
}
