package dev.minibook.controller;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.CreateWebhookRequest;
import dev.minibook.dto.response.WebhookResponse;
import dev.minibook.service.WebhookService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Outbound webhook subscriptions. */
@RestController
@RequestMapping("/api/v1")
public class WebhookController {
    private final WebhookService webhookService;

    public WebhookController(WebhookService webhookService) { this.webhookService = webhookService; }

    @PostMapping("/projects/{projectId}/webhooks")
    public ResponseEntity<WebhookResponse> create(@AuthenticationPrincipal Actor actor, @PathVariable UUID projectId,
                                                  @Valid @RequestBody CreateWebhookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(webhookService.create(actor, projectId, request.url(), request.events()));
    }

    @GetMapping("/projects/{projectId}/webhooks")
    public List<WebhookResponse> list(@PathVariable UUID projectId) {
        return webhookService.list(projectId);
    }

    @DeleteMapping("/webhooks/{id}")
    public Map<String, String> delete(@AuthenticationPrincipal Actor actor, @PathVariable UUID id) {
        webhookService.delete(actor, id);
        return Map.of("status", "deleted");
    }
}
