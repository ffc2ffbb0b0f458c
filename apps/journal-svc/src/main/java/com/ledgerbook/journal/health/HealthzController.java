package com.ledgerbook.journal.health;

import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight health endpoint for external checks. Also reports which ledger version the
 * service currently computes from.
 */
@RestController
public class HealthzController {

    private final LedgerSnapshotRepository repository;

    public HealthzController(LedgerSnapshotRepository repository) {
        this.repository = repository;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        return Map.of("status", "UP", "snapshotVersion", repository.current().version());
    }
}
