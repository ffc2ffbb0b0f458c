package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.controller.dto.LedgerSnapshotDto;
import com.ledgerbook.journal.service.LedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ledger")
public class LedgerSnapshotController {

    private final LedgerService ledgerService;

    public LedgerSnapshotController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<LedgerSnapshotDto> snapshot() {
        return ResponseEntity.ok(LedgerSnapshotDto.from(ledgerService.current()));
    }

    @PutMapping("/snapshot")
    public ResponseEntity<LedgerSnapshotDto> replace(
            @RequestParam("baseVersion") long baseVersion,
            @RequestBody LedgerSnapshotDto request
    ) {
        var stored = ledgerService.replace(request.toModel(), baseVersion);
        return ResponseEntity.ok(LedgerSnapshotDto.from(stored));
    }
}
