package net.kyver.relink.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates API calls by the {@code X-API-Key} header when a secret key is configured.
 * Without one every request passes as anonymous.
 */
@Component
public class SecretKeyValidationFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(SecretKeyValidationFilter.class);

    public static final String API_KEY_HEADER = "X-API-Key";

    private final String secretKey;

    public SecretKeyValidationFilter(@Value("${SECRET_KEY:}") String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean isApiKeyRequired() {
        return secretKey != null && !secretKey.isBlank();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestPath = request.getRequestURI();

        if (isExemptPath(requestPath) || !isApiKeyRequired()) {
            setAuthentication("anonymous", "ROLE_ANONYMOUS");
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(API_KEY_HEADER);
        if (providedKey == null || providedKey.isBlank()) {
            logger.warn("Missing API key for request: {} from {}", requestPath, request.getRemoteAddr());
            sendErrorResponse(response, "API key required. Please provide X-API-Key header.");
            return;
        }

        if (!isValidApiKey(providedKey)) {
            logger.warn("Invalid API key for request: {} from {}", requestPath, request.getRemoteAddr());
            sendErrorResponse(response, "Invalid API key provided.");
            return;
        }

        logger.debug("Authenticated request: {}", requestPath);
        setAuthentication("api-user", "ROLE_API_USER");
        filterChain.doFilter(request, response);
    }

    private boolean isExemptPath(String path) {
        return path.equals("/error") || path.equals("/favicon.ico");
    }

    private boolean isValidApiKey(String providedKey) {
        return MessageDigest.isEqual(
                secretKey.getBytes(StandardCharsets.UTF_8),
                providedKey.getBytes(StandardCharsets.UTF_8));
    }

    private void setAuthentication(String principal, String role) {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(role)));
        SecurityContextHolder.getContext().setAuthentication(auth);
    }

    private void sendErrorResponse(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(String.format(
                "{\"error\":\"%s\",\"status\":%d,\"timestamp\":%d}",
                message, HttpServletResponse.SC_UNAUTHORIZED, System.currentTimeMillis()));
    }
}
