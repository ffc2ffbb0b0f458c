package com.ledgerbook.journal.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final JournalProperties props;

    public StartupDiagnostics(JournalProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var statements = props.statements();
        log.info("Statement config: corporateTaxRate={}, defaultTaxMode='{}', balanceTolerance={}",
                statements.corporateTaxRate(), statements.taxModeOrDefault(), statements.balanceTolerance());
        log.info("Export config: filenamePrefix='{}'", props.export().filenamePrefixOrDefault());
    }
}
