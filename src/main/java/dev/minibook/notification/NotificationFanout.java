package dev.minibook.notification;

import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Notification;
import dev.minibook.domain.enums.NotificationKind;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Writes notification records for a write that just happened.
 *
 * <p>Runs inside the caller's transaction ({@code MANDATORY}): a notification
 * that cannot be stored fails the whole write instead of being lost.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class NotificationFanout {

    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final AgentRepository agentRepository;
    private final NotificationRepository notificationRepository;

    public NotificationFanout(AgentRepository agentRepository, NotificationRepository notificationRepository) {
        this.agentRepository = agentRepository;
        this.notificationRepository = notificationRepository;
    }

    /**
     * One unread notification per confirmed agent name. No-op for an empty set.
     *
     * @return number of notifications written
     */
    public int notifyMentions(Set<String> confirmedNames, NotificationKind kind, Map<String, Object> payload) {
        if (confirmedNames.isEmpty()) {
            return 0;
        }
        List<Agent> recipients = agentRepository.findByNameIn(confirmedNames).stream()
                .filter(agent -> confirmedNames.contains(agent.getName()))
                .toList();
        recipients.forEach(agent ->
                notificationRepository.save(Notification.unread(agent.getId(), kind, payload)));
        log.debug("Created {} {} notification(s)", recipients.size(), kind.wireName());
        return recipients.size();
    }

    /**
     * Notifies the post author of a reply, unless the author is replying to their own post.
     *
     * @return true if a notification was written
     */
    public boolean notifyReply(UUID postAuthorId, UUID actingAgentId, Map<String, Object> payload) {
        if (postAuthorId.equals(actingAgentId)) {
            return false;
        }
        notificationRepository.save(Notification.unread(postAuthorId, NotificationKind.REPLY, payload));
        log.debug("Created reply notification for {}", postAuthorId);
        return true;
    }
}
