package com.chirpy.api.security;

import com.chirpy.api.error.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Authenticates requests that carry a valid session token. Requests without one
 * pass through unauthenticated; whether that is acceptable is decided by
 * {@link SecurityConfig}. Refresh tokens also travel as bearer values, so a token
 * that fails JWT validation is not an error here.
 */
@Component
class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private final JwtService jwtService;
    private final UserDetailsService userDetailsService;

    JwtAuthFilter(JwtService jwtService, UserDetailsService userDetailsService) {
        this.jwtService = jwtService;
        this.userDetailsService = userDetailsService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (req.getHeader(HttpHeaders.AUTHORIZATION) == null
                || SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(req, res);
            return;
        }

        UUID userId;
        try {
            var headers = new ServletServerHttpRequest(req).getHeaders();
            userId = jwtService.validate(CredentialExtractor.extractBearer(headers));
        } catch (AuthException e) {
            log.debug("No session for {} {}: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
            chain.doFilter(req, res);
            return;
        }

        try {
            var userDetails = userDetailsService.loadUserByUsername(userId.toString());
            var authToken = new UsernamePasswordAuthenticationToken(userDetails, null, userDetails.getAuthorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (UsernameNotFoundException e) {
            log.info("Session token for unknown user {}", userId);
        }

        chain.doFilter(req, res);
    }
}
