package com.healthtrack.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs the {@link AuthGate} for every request that carries an Authorization
 * header. A resolved caller becomes the security principal; a failure is
 * parked on the request so the entry point can report the precise reason if
 * the endpoint turns out to need authentication. Endpoints that permit
 * anonymous access simply continue without a principal.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthFilter.class.getName() + ".failure";

    private final AuthGate authGate;

    public JwtAuthFilter(AuthGate authGate) {
        this.authGate = authGate;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null) {
            AuthResult result = authGate.authenticate(header);
            if (result.isAuthenticated()) {
                AuthenticatedUser caller = result.user();
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(caller, null, caller.authorities());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, result.failure());
            }
        }

        filterChain.doFilter(request, response);
    }
}
