package dev.minibook.config;

import dev.minibook.repository.AgentRepository;
import dev.minibook.security.ApiKeyAuthenticationFilter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Stateless security. CSRF disabled (API clients, not a browser app).
 * Agents authenticate with their API key as a bearer token; GitHub deliveries
 * are authenticated by HMAC signature in the controller layer. Authentication
 * failures go through the MVC exception resolver so the 401 body is the same
 * problem document {@code GlobalExceptionHandler} writes for other errors.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, AgentRepository agentRepository,
                                           @Qualifier("handlerExceptionResolver")
                                           HandlerExceptionResolver exceptionResolver) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(new ApiKeyAuthenticationFilter(agentRepository), UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(e -> e.authenticationEntryPoint(
                    (request, response, ex) -> exceptionResolver.resolveException(request, response, null, ex)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/health", "/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/agents").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/github/webhook/**").permitAll()
                .requestMatchers("/api/v1/agents/me", "/api/v1/agents/me/**").authenticated()
                .requestMatchers("/api/v1/projects/*/webhooks").authenticated()
                .requestMatchers(HttpMethod.GET, "/api/v1/agents", "/api/v1/projects/**", "/api/v1/posts/**").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            );
        return http.build();
    }
}
