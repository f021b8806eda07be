package com.phillippitts.signbridge.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext).
 *
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>clientId: from X-Client-ID header (kiosk/tablet identifier, if present)</li>
 * </ul>
 *
 * <p>Pipeline cycle keys (cycleId, mode, scenario) are added by the controller on top of
 * these. The context is cleared after each request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                ThreadContext.put("requestId",
                        requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
                String clientId = http.getHeader(CLIENT_ID_HEADER);
                if (clientId != null && !clientId.isBlank()) {
                    ThreadContext.put("clientId", clientId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }
}
