package com.phillippitts.wfmparity.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every parity API request with a correlation id and, for operator actions, the acting
 * operator, so job, pattern and alert log lines can be traced back to the call that caused them.
 *
 * <p>{@code requestId} comes from {@code X-Request-ID} when the client sends one, otherwise a
 * fresh UUID, and is returned on the response. {@code operator} is taken from
 * {@code X-Operator-ID} when pattern resolution or alert acknowledgement calls supply it.
 * Method and URI are recorded as well.
 *
 * <p>ThreadContext is cleared when the request completes since servlet threads are pooled.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String OPERATOR_ID_HEADER = "X-Operator-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String operator = http.getHeader(OPERATOR_ID_HEADER);
                if (operator != null && !operator.isBlank()) {
                    ThreadContext.put("operator", operator);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
