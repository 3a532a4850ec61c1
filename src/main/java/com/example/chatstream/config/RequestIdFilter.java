package com.example.chatstream.config;

import com.example.chatstream.util.RequestIdHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Genera o reusa un X-Request-Id por petición y lo pone en el MDC.
 *
 * <p>También corre en el dispatch ASYNC que cierra un stream de chat: ahí la respuesta
 * ya está comprometida, así que se recupera el id guardado en la petición en vez de
 * generar otro, y los logs del cierre quedan con el mismo id que la apertura.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    private static final int MAX_LENGTH = 64;

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String requestId = isAsyncDispatch(request) ? storedRequestId(request) : assignRequestId(request, response);

        try (var ignored = RequestIdHolder.use(requestId)) {
            filterChain.doFilter(request, response);
        }
    }

    private String assignRequestId(HttpServletRequest request, HttpServletResponse response) {
        String requestId = resolveRequestId(request);
        request.setAttribute(ATTRIBUTE, requestId);
        response.setHeader(HEADER, requestId);
        return requestId;
    }

    private String storedRequestId(HttpServletRequest request) {
        Object stored = request.getAttribute(ATTRIBUTE);
        return stored instanceof String id ? id : resolveRequestId(request);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String incoming = request.getHeader(HEADER);
        if (incoming != null && !incoming.isBlank() && incoming.length() <= MAX_LENGTH) {
            return incoming.trim();
        }
        return RequestIdHolder.generate();
    }
}
