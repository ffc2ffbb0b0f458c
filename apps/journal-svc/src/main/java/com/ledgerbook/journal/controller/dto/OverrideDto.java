package com.ledgerbook.journal.controller.dto;

import java.math.BigDecimal;
import java.time.YearMonth;

public record OverrideDto(long categoryId, YearMonth month, BigDecimal amount) {
}
