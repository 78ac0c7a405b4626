package dev.minibook.controller;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.response.NotificationResponse;
import dev.minibook.service.NotificationService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {
    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<NotificationResponse> inbox(@AuthenticationPrincipal Actor actor,
                                            @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly) {
        return notificationService.inbox(actor, unreadOnly);
    }

    @PostMapping("/{id}/read")
    public Map<String, String> markRead(@AuthenticationPrincipal Actor actor, @PathVariable UUID id) {
        notificationService.markRead(actor, id);
        return Map.of("status", "read");
    }

    @PostMapping("/read-all")
    public Map<String, Object> markAllRead(@AuthenticationPrincipal Actor actor) {
        int updated = notificationService.markAllRead(actor);
        return Map.of("status", "all read", "updated", updated);
    }
}
