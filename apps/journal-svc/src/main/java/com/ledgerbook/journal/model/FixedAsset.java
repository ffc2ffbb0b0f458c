package com.ledgerbook.journal.model;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

public record FixedAsset(
        long id,
        String name,
        BigDecimal purchaseCost,
        BigDecimal salvageValue,
        int usefulLifeMonths,
        DepreciationMethod depreciationMethod,
        LocalDate purchaseDate,
        LocalDate depreciationStartDate,
        boolean depreciable,
        String notes
) {

    public FixedAsset {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("asset name must be provided");
        }
        if (purchaseCost == null || purchaseCost.signum() < 0) {
            throw new IllegalArgumentException("purchase cost must be zero or positive");
        }
        if (salvageValue != null && salvageValue.signum() < 0) {
            throw new IllegalArgumentException("salvage value must be zero or positive");
        }
        if (usefulLifeMonths < 0) {
            throw new IllegalArgumentException("useful life must not be negative");
        }
        if (purchaseDate == null) {
            throw new IllegalArgumentException("purchase date must be provided");
        }
        purchaseCost = Money.round(purchaseCost);
        salvageValue = Money.orZero(salvageValue);
        if (depreciationMethod == null) {
            depreciationMethod = DepreciationMethod.STRAIGHT_LINE;
        }
    }

    public static FixedAsset of(long id, String name, BigDecimal cost, BigDecimal salvage, int lifeMonths,
            DepreciationMethod method, LocalDate purchaseDate) {
        return new FixedAsset(id, name, cost, salvage, lifeMonths, method, purchaseDate, null, true, null);
    }

    public YearMonth purchaseMonth() {
        return YearMonth.from(purchaseDate);
    }

    /** First month that carries depreciation. */
    public YearMonth depreciationStartMonth() {
        return YearMonth.from(depreciationStartDate != null ? depreciationStartDate : purchaseDate);
    }

    public BigDecimal depreciableBase() {
        return purchaseCost.subtract(salvageValue);
    }
}
