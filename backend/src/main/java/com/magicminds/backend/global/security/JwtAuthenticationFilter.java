package com.magicminds.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.magicminds.backend.modules.auth.application.IdentityTokenVerifier;
import com.magicminds.backend.modules.auth.application.IdentityVerificationException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String SUBJECT_MDC_KEY = "subject";
    private static final List<SimpleGrantedAuthority> PARENT_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_PARENT"));

    private final IdentityTokenVerifier identityTokenVerifier;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(IdentityTokenVerifier identityTokenVerifier, ProblemResponseWriter problemResponseWriter) {
        this.identityTokenVerifier = identityTokenVerifier;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                AuthenticatedSubject principal = identityTokenVerifier.verify(token);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, PARENT_AUTHORITIES);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                MDC.put(SUBJECT_MDC_KEY, principal.subject());
            } catch (IdentityVerificationException ex) {
                SecurityContextHolder.clearContext();
                log.warn("Rejected bearer token on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
                problemResponseWriter.write(request, response, ex.getReason().getStatus(), ex.getReason().getCode(), ex.getMessage());
                return;
            }
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(SUBJECT_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/healthz") || path.startsWith("/readyz") || path.equals("/health")
                || path.startsWith("/actuator/health");
    }
}
