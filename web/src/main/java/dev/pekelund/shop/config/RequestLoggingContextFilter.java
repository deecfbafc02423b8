package dev.pekelund.shop.config;

import dev.pekelund.shop.security.SecurityContextOwnerResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every log line of a request with its request id and, once authentication has run, the owner whose
 * collections the request works on. Registered inside the security filter chain, after the
 * authentication filters and before authorization.
 */
public class RequestLoggingContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingContextFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_KEY = "request.id";
    public static final String OWNER_ID_KEY = "owner.id";

    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final SecurityContextOwnerResolver ownerResolver;

    public RequestLoggingContextFilter(SecurityContextOwnerResolver ownerResolver) {
        this.ownerResolver = ownerResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdOf(request);
        Optional<String> ownerId = ownerResolver.currentOwnerId();

        MDC.put(REQUEST_ID_KEY, requestId);
        ownerId.ifPresent(owner -> MDC.put(OWNER_ID_KEY, owner));
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            if (request.getRequestURI().startsWith("/api/")) {
                log.debug("{} {} -> {} (owner {})", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), ownerId.orElse("anonymous"));
            }
            MDC.remove(OWNER_ID_KEY);
            MDC.remove(REQUEST_ID_KEY);
        }
    }

    private static String requestIdOf(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header) && SAFE_REQUEST_ID.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }
}
