package com.ledgerbook.journal.controller.dto;

/** Envelope for computed statements; {@code snapshotVersion} names the ledger state they reflect. */
public record StatementResponseDto<T>(T statement, Long snapshotVersion, String traceId) {
}
