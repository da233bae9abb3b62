package com.healthtrack.config;

import com.healthtrack.security.JsonAuthHandlers;
import com.healthtrack.security.JwtAuthFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final JwtAuthFilter jwtAuthFilter;
    private final JsonAuthHandlers authHandlers;

    public SecurityConfig(JwtAuthFilter jwtAuthFilter, JsonAuthHandlers authHandlers) {
        this.jwtAuthFilter = jwtAuthFilter;
        this.authHandlers = authHandlers;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // no csrf for a token-authenticated API
            .csrf(csrf -> csrf.disable())
            // CORS rules come from @CrossOrigin on the controllers
            .cors(Customizer.withDefaults())
            // we use JWT, so no HTTP session
            .sessionManagement(sm ->
                sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )
            .authorizeHttpRequests(auth -> auth
                // PUBLIC ENDPOINTS (no token required)
                .requestMatchers(HttpMethod.POST, "/api/auth/register", "/api/auth/login").permitAll()
                // OPTIONAL AUTH: identity used when present, never required
                .requestMatchers(HttpMethod.GET, "/api/health").permitAll()
                .requestMatchers("/error").permitAll()
                // ELEVATED: admin flag required
                .requestMatchers("/api/admin/**").hasRole("ADMIN")
                // everything else requires authentication
                .anyRequest().authenticated()
            )
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(authHandlers)
                .accessDeniedHandler(authHandlers)
            )
            // run JWT filter before UsernamePasswordAuthenticationFilter
            .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    /**
     * The filter only belongs in the security chain; keep Boot from also
     * registering it with the servlet container.
     */
    @Bean
    public FilterRegistrationBean<JwtAuthFilter> jwtAuthFilterRegistration(JwtAuthFilter filter) {
        FilterRegistrationBean<JwtAuthFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
