package com.example.chatstream.config;

import com.example.chatstream.util.RequestIdHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;

/**
 * Traza cada request con duración, patrón y status.
 * En /chat/stream la duración es la del handler; el stream sigue en otro hilo.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTraceFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        long startNs = System.nanoTime();
        String method = request.getMethod();
        String path = request.getRequestURI();

        log.debug("req id={} method={} path={} remote={}",
                RequestIdHolder.get(), method, path, request.getRemoteAddr());

        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - startNs) / 1_000_000;
            int status = response.getStatus();
            String pattern = resolvePattern(request);
            String requestId = RequestIdHolder.get();

            if (status >= 500) {
                log.error("res id={} status={} ms={} method={} path={} pattern={}",
                        requestId, status, elapsedMs, method, path, pattern);
            } else if (status >= 400) {
                log.warn("res id={} status={} ms={} method={} path={} pattern={}",
                        requestId, status, elapsedMs, method, path, pattern);
            } else {
                log.info("res id={} status={} ms={} method={} path={} pattern={}",
                        requestId, status, elapsedMs, method, path, pattern);
            }
        }
    }

    private String resolvePattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern == null ? "" : pattern.toString();
    }
}
