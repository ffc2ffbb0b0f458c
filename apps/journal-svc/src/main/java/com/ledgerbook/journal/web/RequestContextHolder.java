package com.ledgerbook.journal.web;

import java.util.Optional;

public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** {@code snapshotVersion} is the ledger version the request started from, when known. */
    public record RequestContext(String traceId, Long snapshotVersion) {

        public RequestContext withSnapshotVersion(long version) {
            return new RequestContext(traceId, version);
        }
    }
}
