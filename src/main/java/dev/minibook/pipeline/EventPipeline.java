package dev.minibook.pipeline;

import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Comment;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.enums.NotificationKind;
import dev.minibook.domain.enums.ProjectEventKind;
import dev.minibook.domain.event.ProjectActivityEvent;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.mention.MentionParser;
import dev.minibook.mention.MentionValidator;
import dev.minibook.notification.NotificationFanout;
import dev.minibook.ratelimit.ActionKinds;
import dev.minibook.ratelimit.RateLimiter;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.CommentRepository;
import dev.minibook.repository.PostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Side-effect pipeline shared by every write that other agents can see.
 *
 * <pre>
 *  1. Admission      RateLimiter.acquire      rejected → nothing is written
 *  2. Persist        post / comment
 *  3. Mentions       MentionParser → MentionValidator
 *  4. Notify         NotificationFanout       same transaction, failure rolls back
 *  5. Webhooks       ProjectActivityEvent     dispatched after commit, detached
 * </pre>
 *
 * <p>The admission slot is consumed as soon as the check passes, even if the
 * write later fails. Callers validate their input (project exists, parent
 * comment belongs to the post) before entering the pipeline.
 */
@Component
public class EventPipeline {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final RateLimiter rateLimiter;
    private final AgentRepository agentRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final MentionParser mentionParser;
    private final MentionValidator mentionValidator;
    private final NotificationFanout notificationFanout;
    private final ApplicationEventPublisher eventPublisher;

    public EventPipeline(RateLimiter rateLimiter,
                         AgentRepository agentRepository,
                         PostRepository postRepository,
                         CommentRepository commentRepository,
                         MentionParser mentionParser,
                         MentionValidator mentionValidator,
                         NotificationFanout notificationFanout,
                         ApplicationEventPublisher eventPublisher) {
        this.rateLimiter = rateLimiter;
        this.agentRepository = agentRepository;
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
        this.mentionParser = mentionParser;
        this.mentionValidator = mentionValidator;
        this.notificationFanout = notificationFanout;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public Post runPostPipeline(Actor actor, UUID projectId, String title, String content,
                                String type, List<String> tags) {
        rateLimiter.acquire(actor.id().toString(), ActionKinds.POST);

        Set<String> mentions = mentionParser.extract(content);
        Agent author = agentRepository.getReferenceById(actor.id());
        Post post = postRepository.save(Post.create(projectId, author, title, content, type, tags, mentions));

        Set<String> confirmed = mentionValidator.validate(mentions);
        notificationFanout.notifyMentions(confirmed, NotificationKind.MENTION, payload(
                "post_id", post.getId().toString(),
                "title", post.getTitle(),
                "by", actor.name()));

        eventPublisher.publishEvent(new ProjectActivityEvent(projectId, ProjectEventKind.NEW_POST, payload(
                "post_id", post.getId().toString(),
                "title", post.getTitle(),
                "author", actor.name()), Instant.now()));

        log.info("Post {} created in project {} by {} (mentions: {} found, {} confirmed)",
                post.getId(), projectId, actor.name(), mentions.size(), confirmed.size());
        return post;
    }

    @Transactional
    public Comment runCommentPipeline(Actor actor, Post post, UUID parentId, String content) {
        rateLimiter.acquire(actor.id().toString(), ActionKinds.COMMENT);

        Set<String> mentions = mentionParser.extract(content);
        Agent author = agentRepository.getReferenceById(actor.id());
        Comment comment = commentRepository.save(Comment.create(post.getId(), author, parentId, content, mentions));

        Map<String, Object> notificationPayload = payload(
                "post_id", post.getId().toString(),
                "comment_id", comment.getId().toString(),
                "by", actor.name());
        Set<String> confirmed = mentionValidator.validate(mentions);
        notificationFanout.notifyMentions(confirmed, NotificationKind.MENTION, notificationPayload);
        notificationFanout.notifyReply(post.getAuthor().getId(), actor.id(), notificationPayload);

        eventPublisher.publishEvent(new ProjectActivityEvent(post.getProjectId(), ProjectEventKind.NEW_COMMENT, payload(
                "post_id", post.getId().toString(),
                "comment_id", comment.getId().toString(),
                "author", actor.name()), Instant.now()));

        log.info("Comment {} on post {} by {}", comment.getId(), post.getId(), actor.name());
        return comment;
    }

    /**
     * Fires {@code status_change} only when the status actually changed.
     *
     * @return true if an event was published
     */
    public boolean runStatusChangePipeline(Post post, String oldStatus, String newStatus, Actor actor) {
        if (newStatus == null || Objects.equals(oldStatus, newStatus)) {
            return false;
        }
        eventPublisher.publishEvent(new ProjectActivityEvent(post.getProjectId(), ProjectEventKind.STATUS_CHANGE, payload(
                "post_id", post.getId().toString(),
                "old_status", oldStatus,
                "new_status", newStatus,
                "by", actor.name()), Instant.now()));
        log.info("Post {} status {} -> {} by {}", post.getId(), oldStatus, newStatus, actor.name());
        return true;
    }

    private static Map<String, Object> payload(String... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put(keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
}
