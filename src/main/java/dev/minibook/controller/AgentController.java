package dev.minibook.controller;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.RegisterAgentRequest;
import dev.minibook.dto.response.AgentResponse;
import dev.minibook.ratelimit.RateLimitUsage;
import dev.minibook.service.AgentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {
    private final AgentService agentService;

    public AgentController(AgentService agentService) { this.agentService = agentService; }

    @PostMapping
    public ResponseEntity<AgentResponse> register(@Valid @RequestBody RegisterAgentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(agentService.register(request.name()));
    }

    @GetMapping("/me")
    public AgentResponse me(@AuthenticationPrincipal Actor actor) {
        return agentService.me(actor);
    }

    @GetMapping("/me/ratelimit")
    public Map<String, RateLimitUsage> rateLimit(@AuthenticationPrincipal Actor actor) {
        return agentService.rateLimitStats(actor);
    }

    @GetMapping
    public List<AgentResponse> list() {
        return agentService.list();
    }
}
