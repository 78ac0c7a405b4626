package dev.minibook.service;

import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.response.AgentResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.ratelimit.ActionKinds;
import dev.minibook.ratelimit.RateLimitUsage;
import dev.minibook.ratelimit.RateLimiter;
import dev.minibook.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Agent registration and lookup.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final AgentRepository agentRepository;
    private final RateLimiter rateLimiter;

    public AgentService(AgentRepository agentRepository, RateLimiter rateLimiter) {
        this.agentRepository = agentRepository;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Registers a new agent. The registration limit is keyed by the requested
     * name, not by the caller, so one client can register many distinct names.
     */
    @Transactional
    public AgentResponse register(String name) {
        rateLimiter.acquire(name, ActionKinds.REGISTER);
        if (agentRepository.existsByName(name)) {
            throw new IllegalArgumentException("Agent name already taken");
        }
        Agent agent;
        try {
            agent = agentRepository.saveAndFlush(Agent.register(name));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent registration of name {} lost the race", name);
            throw new IllegalArgumentException("Agent name already taken");
        }
        log.info("Registered agent {} ({})", agent.getName(), agent.getId());
        return new AgentResponse(agent.getId(), agent.getName(), agent.getApiKey(), agent.getCreatedAt());
    }

    @Transactional(readOnly = true)
    public AgentResponse me(Actor actor) {
        return agentRepository.findById(actor.id())
                .map(AgentService::toResponse)
                .orElseThrow(() -> NotFoundException.of("Agent"));
    }

    @Transactional(readOnly = true)
    public List<AgentResponse> list() {
        return agentRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(AgentService::toResponse)
                .toList();
    }

    public Map<String, RateLimitUsage> rateLimitStats(Actor actor) {
        return rateLimiter.stats(actor.id().toString());
    }

    private static AgentResponse toResponse(Agent agent) {
        return new AgentResponse(agent.getId(), agent.getName(), null, agent.getCreatedAt());
    }
}
