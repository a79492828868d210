package com.company.energyperformance.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;
import java.util.UUID;

/**
 * Puts the request ID and the calling operator in the MDC, echoes the request ID in the
 * response and writes an audit line for every request that changes state (training,
 * activation, finding resolution, adjustments, manual refreshes).
 * Registered after the security chain so the operator is already authenticated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestLoggingFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_REQUEST_ID_KEY = "requestId";
    public static final String MDC_OPERATOR_KEY = "operator";

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final OperatorContext operatorContext;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String operator = operatorContext.currentOperator();

        MDC.put(MDC_REQUEST_ID_KEY, requestId);
        MDC.put(MDC_OPERATOR_KEY, operator);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            if (MUTATING_METHODS.contains(httpRequest.getMethod())) {
                log.info("Audit: {} {} {} -> {} in {} ms", operator, httpRequest.getMethod(),
                        httpRequest.getRequestURI(), httpResponse.getStatus(), elapsedMs);
            } else {
                log.debug("{} {} -> {} in {} ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), elapsedMs);
            }
            MDC.remove(MDC_REQUEST_ID_KEY);
            MDC.remove(MDC_OPERATOR_KEY);
        }
    }
}
