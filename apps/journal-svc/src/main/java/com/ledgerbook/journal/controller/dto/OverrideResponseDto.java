package com.ledgerbook.journal.controller.dto;

import java.math.BigDecimal;

/** {@code amount} is null once the override has been cleared. */
public record OverrideResponseDto(long categoryId, String month, BigDecimal amount, long snapshotVersion) {
}
