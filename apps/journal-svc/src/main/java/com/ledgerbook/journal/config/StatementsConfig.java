package com.ledgerbook.journal.config;

import com.ledgerbook.journal.statement.BalanceSheetBuilder;
import com.ledgerbook.journal.statement.CashFlowBuilder;
import com.ledgerbook.journal.statement.ProfitAndLossBuilder;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatementsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProfitAndLossBuilder profitAndLossBuilder(JournalProperties props) {
        return new ProfitAndLossBuilder(props.statements().corporateTaxRate());
    }

    @Bean
    public CashFlowBuilder cashFlowBuilder() {
        return new CashFlowBuilder();
    }

    @Bean
    public BalanceSheetBuilder balanceSheetBuilder(
            ProfitAndLossBuilder profitAndLossBuilder,
            CashFlowBuilder cashFlowBuilder,
            JournalProperties props
    ) {
        return new BalanceSheetBuilder(profitAndLossBuilder, cashFlowBuilder, props.statements().balanceTolerance());
    }
}
