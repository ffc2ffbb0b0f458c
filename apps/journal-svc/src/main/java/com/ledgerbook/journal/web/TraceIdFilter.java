package com.ledgerbook.journal.web;

import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each request with a trace id and the ledger version it started against, both in the
 * {@link RequestContextHolder} and in the MDC.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    static final String TRACE_KEY = "trace_id";
    static final String VERSION_KEY = "snapshot_version";

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    private final LedgerSnapshotRepository repository;

    public TraceIdFilter(LedgerSnapshotRepository repository) {
        this.repository = repository;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        long startVersion = repository.current().version();
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, startVersion));
        MDC.put(TRACE_KEY, traceId);
        MDC.put(VERSION_KEY, Long.toString(startVersion));
        response.setHeader(TRACE_HEADER, traceId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} in {} ms (ledger version {})", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), (System.nanoTime() - started) / 1_000_000, startVersion);
            }
            MDC.remove(VERSION_KEY);
            MDC.remove(TRACE_KEY);
            RequestContextHolder.clear();
        }
    }
}
