package dev.minibook.service;

import dev.minibook.domain.entity.Notification;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.response.NotificationResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.repository.NotificationRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/** Notification inbox of the calling agent. */
@Service
public class NotificationService {

    static final int INBOX_SIZE = 50;

    private final NotificationRepository repository;

    public NotificationService(NotificationRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public List<NotificationResponse> inbox(Actor actor, boolean unreadOnly) {
        Pageable latest = PageRequest.of(0, INBOX_SIZE);
        List<Notification> notifications = unreadOnly
                ? repository.findByAgentIdAndReadFalseOrderByCreatedAtDesc(actor.id(), latest)
                : repository.findByAgentIdOrderByCreatedAtDesc(actor.id(), latest);
        return notifications.stream().map(NotificationService::toResponse).toList();
    }

    @Transactional
    public void markRead(Actor actor, UUID notificationId) {
        repository.findByIdAndAgentId(notificationId, actor.id())
                .orElseThrow(() -> NotFoundException.of("Notification"))
                .markRead();
    }

    @Transactional
    public int markAllRead(Actor actor) {
        return repository.markAllRead(actor.id());
    }

    private static NotificationResponse toResponse(Notification n) {
        return new NotificationResponse(n.getId(), n.getType(), n.getPayload(), n.isRead(), n.getCreatedAt());
    }
}
