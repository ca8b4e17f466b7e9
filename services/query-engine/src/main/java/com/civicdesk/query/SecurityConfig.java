/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/query-engine/src/main/java/com/civicdesk/query/SecurityConfig.java
 * Project: CivicDesk Query Engine
 * Description: Spring Security configuration for WebFlux (OAuth2 Resource Server with JWT).
 *              Health and info probes are public; every other request needs a valid
 *              access token whose subject is a staff account id.
 */

package com.civicdesk.query;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.method.configuration.EnableReactiveMethodSecurity;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

/**
 * Central Spring Security configuration for the query engine.
 *
 * <p>The service operates as an OAuth2 resource server. The token only proves who
 * the caller is; what they may do with queries is decided per operation from the
 * role held in the staff directory.</p>
 */
@Configuration
@EnableWebFluxSecurity
@EnableReactiveMethodSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
            .authorizeExchange(exchanges -> exchanges
                .pathMatchers("/actuator/health", "/actuator/info").permitAll()
                .anyExchange().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()))
            .csrf(ServerHttpSecurity.CsrfSpec::disable)
            .build();
    }
}
