package com.ledgerbook.journal.controller.dto;

import com.ledgerbook.journal.model.DepreciationMethod;
import com.ledgerbook.journal.model.FixedAsset;
import java.math.BigDecimal;
import java.time.LocalDate;

public record FixedAssetDto(
        long id,
        String name,
        BigDecimal purchaseCost,
        BigDecimal salvageValue,
        int usefulLifeMonths,
        DepreciationMethod depreciationMethod,
        LocalDate purchaseDate,
        LocalDate depreciationStartDate,
        Boolean depreciable,
        String notes
) {

    public static FixedAssetDto from(FixedAsset asset) {
        return new FixedAssetDto(asset.id(), asset.name(), asset.purchaseCost(), asset.salvageValue(),
                asset.usefulLifeMonths(), asset.depreciationMethod(), asset.purchaseDate(),
                asset.depreciationStartDate(), asset.depreciable(), asset.notes());
    }

    // depreciable unless explicitly switched off
    public FixedAsset toModel() {
        return new FixedAsset(id, name, purchaseCost, salvageValue, usefulLifeMonths, depreciationMethod,
                purchaseDate, depreciationStartDate, depreciable == null || depreciable, notes);
    }
}
