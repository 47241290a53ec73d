package com.di.awardscope.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for MdcRequestFilter and RequestLoggingFilter
 */
@DisplayName("Request Filter Tests")
class MdcRequestFilterTest {

    @Test
    @DisplayName("Should expose request id and path to the chain and clear them afterwards")
    void testMdc_SetAndCleared() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/awardscope/api/contracts/search");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenId = new AtomicReference<>();
        AtomicReference<String> seenPath = new AtomicReference<>();

        new MdcRequestFilter().doFilter(request, response, (req, res) -> {
            seenId.set(MDC.get(MdcRequestFilter.REQUEST_ID));
            seenPath.set(MDC.get(MdcRequestFilter.REQUEST_PATH));
        });

        assertTrue(seenId.get().startsWith("req-"));
        assertEquals("/awardscope/api/contracts/search", seenPath.get());
        assertEquals(seenId.get(), response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }

    @Test
    @DisplayName("Should reuse a caller-supplied request id")
    void testMdc_IncomingHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/awardscope/api/snapshot");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "trace-42");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new MdcRequestFilter().doFilter(request, response, (req, res) -> { });

        assertEquals("trace-42", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("Should ignore an oversized request id header")
    void testMdc_OversizedHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/awardscope/api/snapshot");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "x".repeat(65));
        MockHttpServletResponse response = new MockHttpServletResponse();

        new MdcRequestFilter().doFilter(request, response, (req, res) -> { });

        assertTrue(response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER).startsWith("req-"));
    }

    @Test
    @DisplayName("Should truncate long bodies in request logs")
    void testTruncate() {
        assertEquals("abc", RequestLoggingFilter.truncate("abc", 3, 10));
        assertEquals("aaaaaaaaaa... [truncated, total 50 bytes]",
                RequestLoggingFilter.truncate("a".repeat(50), 50, 10));
    }
}
