package com.ledgerbook.journal.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record OverrideRequestDto(@NotNull BigDecimal amount) {
}
