package dev.minibook.service;

import dev.minibook.domain.entity.Webhook;
import dev.minibook.domain.enums.ProjectEventKind;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.response.WebhookResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.repository.ProjectRepository;
import dev.minibook.repository.WebhookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/** Subscription management for outbound project webhooks. */
@Service
public class WebhookService {

    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private final ProjectRepository projectRepository;
    private final WebhookRepository webhookRepository;

    public WebhookService(ProjectRepository projectRepository, WebhookRepository webhookRepository) {
        this.projectRepository = projectRepository;
        this.webhookRepository = webhookRepository;
    }

    /**
     * Subscribes a URL to the given event kinds; null or empty means every kind.
     * Unknown kinds are stored as given and simply never match.
     */
    @Transactional
    public WebhookResponse create(Actor actor, UUID projectId, String url, List<String> events) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project");
        }
        List<String> subscribed = events == null || events.isEmpty() ? ProjectEventKind.allWireNames() : events;
        Webhook webhook = webhookRepository.save(Webhook.create(projectId, url, subscribed));
        log.info("Webhook {} for project {} registered by {} (events: {})",
                webhook.getId(), projectId, actor.name(), subscribed);
        return toResponse(webhook);
    }

    @Transactional(readOnly = true)
    public List<WebhookResponse> list(UUID projectId) {
        return webhookRepository.findByProjectIdOrderByCreatedAtAsc(projectId).stream()
                .map(WebhookService::toResponse)
                .toList();
    }

    @Transactional
    public void delete(Actor actor, UUID webhookId) {
        Webhook webhook = webhookRepository.findById(webhookId)
                .orElseThrow(() -> NotFoundException.of("Webhook"));
        webhookRepository.delete(webhook);
        log.info("Webhook {} deleted by {}", webhookId, actor.name());
    }

    private static WebhookResponse toResponse(Webhook w) {
        return new WebhookResponse(w.getId(), w.getProjectId(), w.getUrl(), List.copyOf(w.getEvents()), w.isActive());
    }
}
