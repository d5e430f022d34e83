package com.basketgov.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the identity headers set by the auth proxy into a
 * {@link CallerContext}. Requests under {@code /v1} without a workspace are
 * refused with 401.
 */
@Component
public class CallerHeaderFilter extends OncePerRequestFilter {

    public static final String WORKSPACE_HEADER = "X-Workspace-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-Workspace-Role";

    private final ObjectMapper objectMapper;

    public CallerHeaderFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return !request.getRequestURI().startsWith("/v1/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String workspaceId = trimToNull(request.getHeader(WORKSPACE_HEADER));
        if (workspaceId == null) {
            unauthorized(response);
            return;
        }
        request.setAttribute(CallerContext.ATTRIBUTE, new CallerContext(
            workspaceId,
            trimToNull(request.getHeader(USER_HEADER)),
            trimToNull(request.getHeader(ROLE_HEADER))
        ));
        chain.doFilter(request, response);
    }

    private void unauthorized(HttpServletResponse response) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Workspace identity is required");
        body.put("error_code", "UNAUTHORIZED");
        body.put("timestamp", Instant.now().toString());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
