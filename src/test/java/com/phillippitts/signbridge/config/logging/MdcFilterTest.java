package com.phillippitts.signbridge.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdHeaderDuringChain() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("kiosk-req-42");
        Map<String, String> seen = captureContextDuringChain();

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "kiosk-req-42");
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidWhenRequestIdMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("  ");
        Map<String, String> seen = captureContextDuringChain();

        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    void addsClientIdOnlyWhenPresent() throws ServletException, IOException {
        when(request.getHeader("X-Client-ID")).thenReturn("ward-3-tablet");
        Map<String, String> seen = captureContextDuringChain();
        filter.doFilter(request, response, chain);
        assertThat(seen).containsEntry("clientId", "ward-3-tablet");

        HttpServletRequest anonymous = mock(HttpServletRequest.class);
        seen.clear();
        filter.doFilter(anonymous, response, chain);
        assertThat(seen).doesNotContainKey("clientId").containsKey("requestId");
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("r-1");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("r-2");
        doThrow(new ServletException("downstream")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("downstream");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestsThroughUntouched() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);
        ServletResponse plainResponse = mock(ServletResponse.class);
        Map<String, String> seen = captureContextDuringChain();

        filter.doFilter(plain, plainResponse, chain);

        assertThat(seen).isEmpty();
        verify(chain).doFilter(plain, plainResponse);
    }

    private Map<String, String> captureContextDuringChain() throws ServletException, IOException {
        Map<String, String> seen = new HashMap<>();
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());
        return seen;
    }
}
