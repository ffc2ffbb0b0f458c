package com.ledgerbook.journal.repository;

public class SnapshotVersionConflictException extends RuntimeException {

    private final long expectedVersion;
    private final long actualVersion;

    public SnapshotVersionConflictException(long expectedVersion, long actualVersion) {
        super("Ledger snapshot changed since version " + expectedVersion + " (now " + actualVersion + ")");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
