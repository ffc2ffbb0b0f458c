package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.LedgerFixtures;
import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerEndpointsTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    LedgerSnapshotRepository repository;

    private long version;

    @BeforeEach
    void loadLedger() {
        version = repository.replace(LedgerFixtures.balancedLedger(), repository.current().version()).version();
    }

    @Test
    void snapshotRoundTripsThroughApi() throws Exception {
        String body = """
                {
                  "categories": [
                    {"id": 1, "name": "Sales"},
                    {"id": 2, "name": "Rent", "cashflowSortOrder": 1}
                  ],
                  "transactions": [
                    {"id": 1, "entryDate": "2024-01-03", "categoryId": 1, "amount": 900, "type": "RECEIVABLE",
                     "status": "RECEIVED", "monthDue": "2024-01", "monthPaid": "2024-01"},
                    {"id": 2, "entryDate": "2024-01-04", "categoryId": 2, "amount": 400, "type": "PAYABLE",
                     "status": "PENDING", "monthDue": "2024-01"}
                  ],
                  "fixedAssets": [
                    {"id": 1, "name": "Laptop", "purchaseCost": 1200, "usefulLifeMonths": 12,
                     "depreciationMethod": "STRAIGHT_LINE", "purchaseDate": "2024-01-02"}
                  ],
                  "plOverrides": [
                    {"categoryId": 2, "month": "2024-02", "amount": 450}
                  ]
                }
                """;

        mockMvc.perform(put("/ledger/snapshot").param("baseVersion", String.valueOf(version))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value((int) version + 1))
                .andExpect(jsonPath("$.transactions", hasSize(2)))
                .andExpect(jsonPath("$.fixedAssets[0].depreciable").value(true))
                .andExpect(jsonPath("$.plOverrides[0].month").value("2024-02"));

        mockMvc.perform(get("/schedules/assets/1/depreciation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries", hasSize(12)))
                .andExpect(jsonPath("$.entries[0].month").value("2024-01"))
                .andExpect(jsonPath("$.total").value(1200.0));
    }

    @Test
    void staleSnapshotWriteConflicts() throws Exception {
        mockMvc.perform(put("/ledger/snapshot").param("baseVersion", String.valueOf(version - 1))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SNAPSHOT_VERSION_CONFLICT"))
                .andExpect(jsonPath("$.details.currentVersion").value((int) version));
    }

    @Test
    void invalidRecordIsRejected() throws Exception {
        String body = """
                {"transactions": [{"id": 1, "categoryId": 1, "amount": 10, "type": "PAYABLE", "status": "RECEIVED",
                                   "monthDue": "2024-01", "monthPaid": "2024-01"}]}
                """;
        mockMvc.perform(put("/ledger/snapshot").param("baseVersion", String.valueOf(version))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST_BODY"));
    }

    @Test
    void amortizationScheduleForLoan() throws Exception {
        mockMvc.perform(get("/schedules/loans/1/amortization"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.levelPayment").value(100.0))
                .andExpect(jsonPath("$.entries", hasSize(12)))
                .andExpect(jsonPath("$.entries[0].month").value("2024-02"))
                .andExpect(jsonPath("$.finalBalance").value(0.0));
    }

    @Test
    void unknownScheduleIsNotFound() throws Exception {
        mockMvc.perform(get("/schedules/loans/42/amortization"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.recordId").value(42));
    }

    @Test
    void profitAndLossOverrideIsAppliedAndCleared() throws Exception {
        mockMvc.perform(put("/overrides/profit-and-loss/{categoryId}/{month}", LedgerFixtures.RENT, "2024-03")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 400}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(400.0))
                .andExpect(jsonPath("$.month").value("2024-03"));

        mockMvc.perform(get("/statements/profit-and-loss")
                        .param("currentMonth", "2024-03").param("from", "2024-03").param("to", "2024-03")
                        .param("taxMode", "passthrough"))
                .andExpect(jsonPath("$.statement.total.netIncomeBeforeTax").value(1500.0));

        mockMvc.perform(delete("/overrides/profit-and-loss/{categoryId}/{month}", LedgerFixtures.RENT, "2024-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").doesNotExist());
    }

    @Test
    void incomeTaxOverrideNeedsNoCategory() throws Exception {
        mockMvc.perform(put("/overrides/profit-and-loss/{categoryId}/{month}", -1, "2024-03")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 12.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categoryId").value(-1));

        mockMvc.perform(put("/overrides/cash-flow/{categoryId}/{month}", -1, "2024-03")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 12.5}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void cashFlowOverrideMovesEndingBalance() throws Exception {
        mockMvc.perform(put("/overrides/cash-flow/{categoryId}/{month}", LedgerFixtures.SALES, "2024-03")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 2000}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/statements/cash-flow").param("currentMonth", "2024-03").param("to", "2024-03"))
                .andExpect(jsonPath("$.statement.columns[2].endingBalance").value(15800.0));
    }

    @Test
    void overrideRequiresAmountAndValidMonth() throws Exception {
        mockMvc.perform(put("/overrides/cash-flow/{categoryId}/{month}", LedgerFixtures.SALES, "2024-03")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(delete("/overrides/cash-flow/{categoryId}/{month}", LedgerFixtures.SALES, "2024-3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_MONTH_FORMAT"));
    }

    @Test
    void exportsTransactionsAsCsv() throws Exception {
        mockMvc.perform(get("/export/transactions.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("transactions_")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("Entry Date,Category,Type,Amount")))
                .andExpect(content().string(containsString("2024-03-01,Sales,Receivable,2000.00,,Pending,2024-03,,,,")));
    }
}
