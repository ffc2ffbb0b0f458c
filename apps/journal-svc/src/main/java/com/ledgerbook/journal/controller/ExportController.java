package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.config.JournalProperties;
import com.ledgerbook.journal.service.LedgerService;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/export")
public class ExportController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final LedgerService ledgerService;
    private final JournalProperties properties;
    private final Clock clock;

    public ExportController(LedgerService ledgerService, JournalProperties properties, Clock clock) {
        this.ledgerService = ledgerService;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/transactions.csv")
    public ResponseEntity<String> transactionsCsv() {
        String filename = properties.export().filenamePrefixOrDefault() + "_" + LocalDate.now(clock) + ".csv";
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(ledgerService.exportTransactionsCsv());
    }
}
