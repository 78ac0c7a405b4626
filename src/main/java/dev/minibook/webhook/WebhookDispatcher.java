package dev.minibook.webhook;

import dev.minibook.domain.entity.Webhook;
import dev.minibook.domain.enums.ProjectEventKind;
import dev.minibook.repository.WebhookRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort, fire-and-forget delivery of project events to webhook subscribers.
 *
 * <pre>
 *  dispatch()  ── returns immediately
 *     └─ [webhookExecutor] load active subscriptions of the project
 *           ├─ [webhookExecutor] POST subscriber A   (own timeout)
 *           └─ [webhookExecutor] POST subscriber B   (own timeout)
 * </pre>
 *
 * <p>Each subscriber gets its own task, so a slow or failing endpoint never
 * delays or prevents delivery to another one. Failures are logged and counted
 * here and go no further: no retry, nothing surfaces to the triggering request.
 */
@Component
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryClient deliveryClient;
    private final TaskExecutor executor;
    private final MeterRegistry meterRegistry;

    public WebhookDispatcher(WebhookRepository webhookRepository,
                             WebhookDeliveryClient deliveryClient,
                             @Qualifier("webhookExecutor") TaskExecutor executor,
                             MeterRegistry meterRegistry) {
        this.webhookRepository = webhookRepository;
        this.deliveryClient = deliveryClient;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public void dispatch(UUID projectId, ProjectEventKind kind, Map<String, Object> payload) {
        executor.execute(() -> fanOut(projectId, kind, payload));
    }

    void fanOut(UUID projectId, ProjectEventKind kind, Map<String, Object> payload) {
        List<Webhook> subscribers;
        try {
            subscribers = webhookRepository.findByProjectIdAndActiveTrue(projectId).stream()
                    .filter(webhook -> webhook.subscribesTo(kind.wireName()))
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Could not load webhooks for project {} (event={}): {}", projectId, kind.wireName(), e.getMessage());
            return;
        }
        if (subscribers.isEmpty()) {
            return;
        }

        WebhookEnvelope envelope = new WebhookEnvelope(kind.wireName(), projectId.toString(), payload);
        log.debug("Dispatching {} to {} webhook(s) of project {}", kind.wireName(), subscribers.size(), projectId);
        for (Webhook webhook : subscribers) {
            UUID webhookId = webhook.getId();
            String url = webhook.getUrl();
            executor.execute(() -> deliver(webhookId, url, envelope));
        }
    }

    void deliver(UUID webhookId, String url, WebhookEnvelope envelope) {
        try {
            int status = deliveryClient.deliver(url, envelope);
            meterRegistry.counter("minibook.webhook.deliveries", "outcome", "success").increment();
            log.debug("Webhook {} delivered: event={}, status={}", webhookId, envelope.event(), status);
        } catch (RuntimeException e) {
            meterRegistry.counter("minibook.webhook.deliveries", "outcome", "failure").increment();
            log.warn("Webhook {} delivery failed: event={}, url={}: {}", webhookId, envelope.event(), url, e.getMessage());
        }
    }
}
