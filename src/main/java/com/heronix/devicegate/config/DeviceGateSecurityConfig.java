package com.heronix.devicegate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for Heronix DeviceGate.
 *
 * Devices authenticate through registration and the whitelist, not through
 * Spring Security, so device endpoints stay open in every profile.
 */
@Configuration
@EnableWebSecurity
public class DeviceGateSecurityConfig {

    /**
     * Default/development security configuration - permissive for testing.
     */
    @Bean
    @Profile("!prod")
    public SecurityFilterChain devSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .anyRequest().permitAll()
            )
            .headers(headers -> headers
                .frameOptions(frame -> frame.disable()) // For H2 console
            );

        return http.build();
    }

    /**
     * Production security configuration - admin endpoints need HTTP Basic.
     */
    @Bean
    @Profile("prod")
    public SecurityFilterChain prodSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health").permitAll()
                // Device traffic, gated by the whitelist
                .requestMatchers(HttpMethod.POST, "/api/v1/devices/register", "/api/v1/devices/data").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/devices/**").permitAll()
                // Administration
                .requestMatchers("/api/v1/auth/**").authenticated()
                .requestMatchers(HttpMethod.DELETE, "/api/v1/devices/**").authenticated()
                .anyRequest().denyAll()
            )
            .httpBasic(Customizer.withDefaults())
            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none';"))
                .frameOptions(frame -> frame.deny())
            );

        return http.build();
    }
}
