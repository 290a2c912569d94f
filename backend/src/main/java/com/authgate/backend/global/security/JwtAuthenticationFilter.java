package com.authgate.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.global.error.ProblemResponse;
import com.authgate.backend.global.error.StoreUnavailableException;
import com.authgate.backend.modules.token.application.TokenManager;
import com.authgate.backend.modules.token.domain.TokenClaims;
import com.authgate.backend.modules.token.domain.TokenType;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens. A token is accepted only while it is not revoked and its session is alive,
 * and every rejection looks the same to the client.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> TOKEN_EXCHANGE_PATHS = Set.of("/auth/refresh", "/auth/logout");

    private final TokenManager tokenManager;
    private final ProblemResponseWriter writer;

    public JwtAuthenticationFilter(TokenManager tokenManager, ProblemResponseWriter writer) {
        this.tokenManager = tokenManager;
        this.writer = writer;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                TokenClaims claims = tokenManager.validateWithSession(token);
                if (claims.type() != TokenType.ACCESS) {
                    rejectUnauthorized(request, response, "refresh token used as access token");
                    return;
                }
                List<SimpleGrantedAuthority> authorities = claims.roles().stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                        .toList();

                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        claims.userId(),
                        claims.sessionId(),
                        claims.roles()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (StoreUnavailableException ex) {
                SecurityContextHolder.clearContext();
                ProblemResponse body = ProblemResponse.of(HttpStatus.SERVICE_UNAVAILABLE, ex.getCode(),
                        "Authentication store unavailable", request.getRequestURI());
                writer.write(response, body, ex.getRetryAfterSeconds());
                return;
            } catch (ProblemException ex) {
                rejectUnauthorized(request, response, ex.getCode());
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return TOKEN_EXCHANGE_PATHS.contains(path) || path.startsWith("/actuator/health");
    }

    private void rejectUnauthorized(HttpServletRequest request, HttpServletResponse response, String cause) throws IOException {
        SecurityContextHolder.clearContext();
        log.debug("Bearer token rejected path={} cause={}", request.getRequestURI(), cause);
        writer.write(response, ProblemResponse.unauthorized(request.getRequestURI()), null);
    }
}
