package com.ledgerbook.journal.config;

import com.ledgerbook.journal.model.TaxMode;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "journal")
public record JournalProperties(
        Statements statements,
        Export export
) {

    @ConstructorBinding
    public JournalProperties {
        if (statements == null) {
            throw new IllegalArgumentException("statements configuration must be provided");
        }
    }

    public Export export() {
        return export != null ? export : new Export(null);
    }

    public record Statements(BigDecimal corporateTaxRate, String defaultTaxMode, BigDecimal balanceTolerance) {
        public Statements {
            if (corporateTaxRate == null) {
                corporateTaxRate = new BigDecimal("0.21");
            }
            if (corporateTaxRate.signum() < 0 || corporateTaxRate.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("corporateTaxRate must be between 0 and 1");
            }
            if (balanceTolerance == null) {
                balanceTolerance = new BigDecimal("0.01");
            }
            if (balanceTolerance.signum() <= 0) {
                throw new IllegalArgumentException("balanceTolerance must be positive");
            }
            if (defaultTaxMode == null || defaultTaxMode.isBlank()) {
                defaultTaxMode = TaxMode.CORPORATE.name();
            }
            // fail at startup rather than on the first request
            TaxMode.fromValue(defaultTaxMode);
        }

        public TaxMode taxModeOrDefault() {
            return TaxMode.fromValue(defaultTaxMode);
        }
    }

    public record Export(String filenamePrefix) {
        public String filenamePrefixOrDefault() {
            return (filenamePrefix != null && !filenamePrefix.isBlank()) ? filenamePrefix : "transactions";
        }
    }
}
