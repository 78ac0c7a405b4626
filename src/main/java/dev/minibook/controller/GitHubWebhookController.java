package dev.minibook.controller;

import dev.minibook.infrastructure.github.GitHubEventPayload;
import dev.minibook.infrastructure.github.WebhookSignatureVerifier;
import dev.minibook.service.GitHubBridgeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * GitHub webhook receiver. The HMAC signature is checked against the raw body
 * before anything is deserialized.
 */
@RestController
@RequestMapping("/api/v1/github")
public class GitHubWebhookController {
    private static final Logger log = LoggerFactory.getLogger(GitHubWebhookController.class);
    private static final Set<String> BRIDGED_EVENTS = Set.of("issues", "pull_request");

    private final WebhookSignatureVerifier signatureVerifier;
    private final GitHubBridgeService bridgeService;
    private final ObjectMapper objectMapper;

    public GitHubWebhookController(WebhookSignatureVerifier signatureVerifier,
                                   GitHubBridgeService bridgeService,
                                   ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.bridgeService = bridgeService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/webhook/{projectId}")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @PathVariable UUID projectId,
            @RequestHeader("X-GitHub-Event") String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody String rawBody) {

        if (!signatureVerifier.isValid(rawBody.getBytes(StandardCharsets.UTF_8), signature)) {
            log.warn("GitHub signature verification failed for delivery={}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", "invalid signature"));
        }

        if (!BRIDGED_EVENTS.contains(eventType)) {
            return ResponseEntity.ok(Map.of("status", "ignored", "reason", "event not bridged"));
        }

        GitHubEventPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, GitHubEventPayload.class);
        } catch (JacksonException e) {
            log.warn("Unreadable GitHub payload for delivery={}: {}", deliveryId, e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of("status", "error", "reason", "invalid payload"));
        }

        log.info("GitHub webhook: event={}, delivery={}, action={}", eventType, deliveryId, payload.action());
        GitHubBridgeService.Result result = bridgeService.bridge(projectId, eventType, payload);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.outcome().name().toLowerCase(Locale.ROOT));
        if (result.postId() != null) {
            body.put("post_id", result.postId().toString());
        }
        return ResponseEntity.ok(body);
    }
}
