package com.dentistflow.dentistflowserver.config;

import com.dentistflow.dentistflowserver.exception.UnauthorizedException;
import com.dentistflow.dentistflowserver.security.SessionPrincipal;
import com.dentistflow.dentistflowserver.security.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Resolves {@code Authorization: Bearer <token>} into a {@link SessionPrincipal}.
 * Requests without a usable token continue unauthenticated and are rejected by the
 * entry point if the path is protected.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    /** Request attribute telling the entry point why authentication failed. */
    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthFilter.class.getName() + ".error";

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String uri = request.getRequestURI();
        if (!uri.startsWith("/api/")) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, "Authorization header required");
            filterChain.doFilter(request, response);
            return;
        }

        String token = header.startsWith(BEARER_PREFIX) ? header.substring(BEARER_PREFIX.length()).trim() : header.trim();
        try {
            SessionPrincipal principal = tokenService.validate(token);
            setAuthentication(principal, request);
        } catch (UnauthorizedException e) {
            SecurityContextHolder.clearContext();
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getMessage());
            log.debug("Unauthenticated request to {} from {}", uri, request.getRemoteAddr());
        }

        filterChain.doFilter(request, response);
    }

    private void setAuthentication(SessionPrincipal principal, HttpServletRequest request) {
        List<SimpleGrantedAuthority> authorities =
                Collections.singletonList(new SimpleGrantedAuthority(principal.getRole().getAuthority()));

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                principal, null, authorities);

        auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(auth);
    }
}
