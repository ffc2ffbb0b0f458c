package com.ledgerbook.journal.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.ledgerbook.journal.LedgerFixtures;
import com.ledgerbook.journal.repository.LedgerSnapshotRepository;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    @Mock
    private LedgerSnapshotRepository repository;

    private TraceIdFilter filter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(repository.current()).thenReturn(LedgerFixtures.balancedLedger());
        filter = new TraceIdFilter(repository);
    }

    @Test
    void requestCarriesTraceAndStartingLedgerVersion() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/statements/summary");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "trace-abc");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<RequestContextHolder.RequestContext> seen = new AtomicReference<>();
        AtomicReference<String> mdcVersion = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.set(RequestContextHolder.get().orElseThrow());
            mdcVersion.set(MDC.get(TraceIdFilter.VERSION_KEY));
        });

        assertThat(seen.get().traceId()).isEqualTo("trace-abc");
        assertThat(seen.get().snapshotVersion()).isEqualTo(1L);
        assertThat(mdcVersion.get()).isEqualTo("1");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("trace-abc");
        assertThat(RequestContextHolder.get()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.TRACE_KEY)).isNull();
        assertThat(MDC.get(TraceIdFilter.VERSION_KEY)).isNull();
    }

    @Test
    void blankTraceHeaderGetsGeneratedId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/healthz");
        request.addHeader(TraceIdFilter.TRACE_HEADER, " ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isNotBlank().isNotEqualTo(" ");
    }
}
