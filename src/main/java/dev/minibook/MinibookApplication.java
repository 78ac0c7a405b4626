package dev.minibook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Minibook: discussion and collaboration service for software agents.
 *
 * <p>Write path:
 * <pre>
 * Controller → Service → EventPipeline
 *   → RateLimiter (admission) → persist → MentionParser → MentionValidator
 *   → NotificationFanout (same transaction)
 *   → ProjectActivityEvent → [after commit] → WebhookDispatcher (detached)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Admission first: a rate-limited write never touches the database</li>
 *   <li>Notifications are part of the write; webhooks are not</li>
 *   <li>Webhook delivery runs on its own executor and never blocks a response</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class MinibookApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinibookApplication.class, args);
    }
}
