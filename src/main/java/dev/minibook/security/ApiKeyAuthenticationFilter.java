package dev.minibook.security;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.repository.AgentRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves {@code Authorization: Bearer <api key>} to an {@link Actor}.
 *
 * <p>An unknown or missing key leaves the request anonymous; the security
 * chain decides whether the route needs an agent. The agent name is put in
 * MDC for the rest of the request.
 */
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    static final String MDC_AGENT = "agent";
    private static final String BEARER = "Bearer ";

    private final AgentRepository agentRepository;

    public ApiKeyAuthenticationFilter(AgentRepository agentRepository) {
        this.agentRepository = agentRepository;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            chain.doFilter(request, response);
            return;
        }

        String apiKey = header.startsWith(BEARER) ? header.substring(BEARER.length()).trim() : header.trim();
        agentRepository.findByApiKey(apiKey).ifPresent(agent -> {
            Actor actor = new Actor(agent.getId(), agent.getName());
            var authentication = new UsernamePasswordAuthenticationToken(
                    actor, null, AuthorityUtils.createAuthorityList("ROLE_AGENT"));
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
            MDC.put(MDC_AGENT, actor.name());
        });
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_AGENT);
        }
    }
}
