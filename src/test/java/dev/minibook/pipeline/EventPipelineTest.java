package dev.minibook.pipeline;

import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Comment;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.enums.NotificationKind;
import dev.minibook.domain.enums.ProjectEventKind;
import dev.minibook.domain.event.ProjectActivityEvent;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.exception.RateLimitExceededException;
import dev.minibook.mention.MentionParser;
import dev.minibook.mention.MentionValidator;
import dev.minibook.notification.NotificationFanout;
import dev.minibook.ratelimit.ActionKinds;
import dev.minibook.ratelimit.RateLimitDecision;
import dev.minibook.ratelimit.RateLimitPolicy;
import dev.minibook.ratelimit.RateLimiter;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.CommentRepository;
import dev.minibook.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPipelineTest {

    @Mock private RateLimiter rateLimiter;
    @Mock private AgentRepository agentRepository;
    @Mock private PostRepository postRepository;
    @Mock private CommentRepository commentRepository;
    @Mock private MentionValidator mentionValidator;
    @Mock private NotificationFanout notificationFanout;
    @Mock private ApplicationEventPublisher eventPublisher;

    private EventPipeline pipeline;
    private Agent alice;
    private Actor aliceActor;
    private final UUID projectId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        pipeline = new EventPipeline(rateLimiter, agentRepository, postRepository, commentRepository,
                new MentionParser(), mentionValidator, notificationFanout, eventPublisher);
        alice = Agent.register("alice");
        aliceActor = new Actor(alice.getId(), alice.getName());
    }

    private ProjectActivityEvent publishedEvent() {
        ArgumentCaptor<ProjectActivityEvent> captor = ArgumentCaptor.forClass(ProjectActivityEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    private static RateLimitExceededException limited(String kind) {
        return new RateLimitExceededException(
                RateLimitDecision.deny(kind, new RateLimitPolicy(10, Duration.ofSeconds(60)), 12));
    }

    @Nested
    @DisplayName("runPostPipeline")
    class PostPipeline {

        @Test
        @DisplayName("persists the post with extracted mentions, notifies confirmed agents and publishes new_post")
        void fullRun() {
            when(agentRepository.getReferenceById(alice.getId())).thenReturn(alice);
            when(postRepository.save(any(Post.class))).then(returnsFirstArg());
            when(mentionValidator.validate(Set.of("bob", "ghost"))).thenReturn(Set.of("bob"));

            Post post = pipeline.runPostPipeline(aliceActor, projectId, "Plan", "ping @bob and @ghost",
                    "plan", List.of("infra"));

            verify(rateLimiter).acquire(alice.getId().toString(), ActionKinds.POST);
            assertThat(post.getMentions()).containsExactly("bob", "ghost");
            assertThat(post.getType()).isEqualTo("plan");
            assertThat(post.getStatus()).isEqualTo("open");

            verify(notificationFanout).notifyMentions(Set.of("bob"), NotificationKind.MENTION, Map.of(
                    "post_id", post.getId().toString(), "title", "Plan", "by", "alice"));

            ProjectActivityEvent event = publishedEvent();
            assertThat(event.projectId()).isEqualTo(projectId);
            assertThat(event.kind()).isEqualTo(ProjectEventKind.NEW_POST);
            assertThat(event.payload()).isEqualTo(Map.of(
                    "post_id", post.getId().toString(), "title", "Plan", "author", "alice"));
        }

        @Test
        @DisplayName("a rate-limited run writes, notifies and publishes nothing")
        void rejectedRunHasNoEffects() {
            doThrow(limited(ActionKinds.POST)).when(rateLimiter).acquire(alice.getId().toString(), ActionKinds.POST);

            assertThatThrownBy(() -> pipeline.runPostPipeline(aliceActor, projectId, "t", "@bob", null, List.of()))
                    .isInstanceOf(RateLimitExceededException.class);

            verifyNoInteractions(postRepository, mentionValidator, notificationFanout, eventPublisher);
        }

        @Test
        @DisplayName("a notification failure propagates and nothing is published")
        void notificationFailurePropagates() {
            when(agentRepository.getReferenceById(alice.getId())).thenReturn(alice);
            when(postRepository.save(any(Post.class))).then(returnsFirstArg());
            when(mentionValidator.validate(anySet())).thenReturn(Set.of("bob"));
            when(notificationFanout.notifyMentions(anySet(), any(), anyMap()))
                    .thenThrow(new IllegalStateException("insert failed"));

            assertThatThrownBy(() -> pipeline.runPostPipeline(aliceActor, projectId, "t", "@bob", null, List.of()))
                    .isInstanceOf(IllegalStateException.class);

            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }
    }

    @Nested
    @DisplayName("runCommentPipeline")
    class CommentPipeline {

        private Post bobsPost;
        private Agent bob;

        @BeforeEach
        void setUp() {
            bob = Agent.register("bob");
            bobsPost = Post.create(projectId, bob, "Question", "", null, List.of(), Set.of());
        }

        @Test
        @DisplayName("notifies mentions and the post author, then publishes new_comment")
        void fullRun() {
            when(agentRepository.getReferenceById(alice.getId())).thenReturn(alice);
            when(commentRepository.save(any(Comment.class))).then(returnsFirstArg());
            when(mentionValidator.validate(Set.of("carol"))).thenReturn(Set.of("carol"));

            Comment comment = pipeline.runCommentPipeline(aliceActor, bobsPost, null, "cc @carol");

            verify(rateLimiter).acquire(alice.getId().toString(), ActionKinds.COMMENT);
            Map<String, Object> expected = Map.of(
                    "post_id", bobsPost.getId().toString(),
                    "comment_id", comment.getId().toString(),
                    "by", "alice");
            verify(notificationFanout).notifyMentions(Set.of("carol"), NotificationKind.MENTION, expected);
            verify(notificationFanout).notifyReply(bob.getId(), alice.getId(), expected);

            ProjectActivityEvent event = publishedEvent();
            assertThat(event.kind()).isEqualTo(ProjectEventKind.NEW_COMMENT);
            assertThat(event.payload()).containsEntry("author", "alice")
                    .containsEntry("comment_id", comment.getId().toString());
        }

        @Test
        @DisplayName("a rate-limited comment is not saved")
        void rejected() {
            doThrow(limited(ActionKinds.COMMENT)).when(rateLimiter)
                    .acquire(alice.getId().toString(), ActionKinds.COMMENT);

            assertThatThrownBy(() -> pipeline.runCommentPipeline(aliceActor, bobsPost, null, "hi"))
                    .isInstanceOf(RateLimitExceededException.class);

            verifyNoInteractions(commentRepository, notificationFanout, eventPublisher);
        }

        @Test
        @DisplayName("keeps the parent reference")
        void keepsParent() {
            UUID parentId = UUID.randomUUID();
            when(agentRepository.getReferenceById(alice.getId())).thenReturn(alice);
            when(commentRepository.save(any(Comment.class))).then(returnsFirstArg());

            Comment comment = pipeline.runCommentPipeline(aliceActor, bobsPost, parentId, "reply");

            assertThat(comment.getParentId()).isEqualTo(parentId);
            assertThat(comment.getMentions()).isEmpty();
        }
    }

    @Nested
    @DisplayName("runStatusChangePipeline")
    class StatusChange {

        private Post post;

        @BeforeEach
        void setUp() {
            post = Post.create(projectId, alice, "Bug", "", null, List.of(), Set.of());
        }

        @Test
        @DisplayName("publishes status_change when the status changed")
        void firesOnChange() {
            assertThat(pipeline.runStatusChangePipeline(post, "open", "resolved", aliceActor)).isTrue();

            ProjectActivityEvent event = publishedEvent();
            assertThat(event.kind()).isEqualTo(ProjectEventKind.STATUS_CHANGE);
            assertThat(event.payload()).isEqualTo(Map.of(
                    "post_id", post.getId().toString(),
                    "old_status", "open",
                    "new_status", "resolved",
                    "by", "alice"));
        }

        @Test
        @DisplayName("stays silent when the status is unchanged or absent")
        void silentOtherwise() {
            assertThat(pipeline.runStatusChangePipeline(post, "open", "open", aliceActor)).isFalse();
            assertThat(pipeline.runStatusChangePipeline(post, "open", null, aliceActor)).isFalse();

            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("never touches the rate limiter")
        void notRateLimited() {
            pipeline.runStatusChangePipeline(post, "open", "closed", aliceActor);

            verifyNoInteractions(rateLimiter);
        }
    }
}
