package com.phillippitts.enginecoordinator.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Seeds Log4j2's ThreadContext for every inbound call so coordinator logs can be traced back to
 * the request that caused them.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID when it is a safe token, else a generated UUID; echoed in
 *       the response so callers can correlate a {@code CoordinationResult} with server logs</li>
 *   <li>clientId: from X-Client-ID when it is a safe token</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>Header values end up verbatim in log lines, so anything outside {@code [A-Za-z0-9._:-]}
 * or longer than 64 characters is discarded. Each call under {@code /api/} is logged once on
 * completion with its status and latency. The context is always cleared afterwards; the
 * coordinator's taskId and taskKind entries go with it.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(MdcFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";
    static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private static final String API_PREFIX = "/api/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            try {
                chain.doFilter(request, response);
            } finally {
                ThreadContext.clearAll();
            }
            return;
        }
        long t0 = System.nanoTime();
        try {
            String requestId = safeToken(http.getHeader(REQUEST_ID_HEADER));
            if (requestId == null) {
                requestId = UUID.randomUUID().toString();
            }
            ThreadContext.put("requestId", requestId);
            String clientId = safeToken(http.getHeader(CLIENT_ID_HEADER));
            if (clientId != null) {
                ThreadContext.put("clientId", clientId);
            }
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            logCompletion(http, response, t0);
            ThreadContext.clearAll();
        }
    }

    /** The header value if it is safe to log, else null. */
    static String safeToken(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return SAFE_TOKEN.matcher(trimmed).matches() ? trimmed : null;
    }

    private static void logCompletion(HttpServletRequest http, ServletResponse response, long t0) {
        String uri = http.getRequestURI();
        if (uri == null || !uri.startsWith(API_PREFIX)) {
            return;
        }
        int status = response instanceof HttpServletResponse r ? r.getStatus() : 0;
        LOG.debug("{} {} -> {} in {}ms", http.getMethod(), uri, status,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
    }
}
