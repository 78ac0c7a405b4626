package dev.minibook.webhook;

import dev.minibook.domain.event.ProjectActivityEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges committed project activity to webhook dispatch.
 *
 * <p>{@code @TransactionalEventListener} holds the event until the write
 * commits, so a receiver that calls back never sees a post or comment that is
 * not there yet, and a rolled-back write fires nothing.
 */
@Component
public class ProjectActivityListener {

    private final WebhookDispatcher dispatcher;

    public ProjectActivityListener(WebhookDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onProjectActivity(ProjectActivityEvent event) {
        dispatcher.dispatch(event.projectId(), event.kind(), event.payload());
    }
}
