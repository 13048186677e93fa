package com.example.ficregistry.http;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with an id (echoed back in {@code X-Request-Id}) and the calling
 * actor, both kept in the MDC for log lines.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String ACTOR_HEADER = "X-Actor";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String rid = req.getHeader(REQUEST_ID_HEADER);
        if (rid == null || rid.isBlank()) {
            rid = UUID.randomUUID().toString();
        }
        MDC.put("requestId", rid);
        MDC.put("actor", Actors.resolve(req.getHeader(ACTOR_HEADER)));
        res.setHeader(REQUEST_ID_HEADER, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove("requestId");
            MDC.remove("actor");
        }
    }
}
