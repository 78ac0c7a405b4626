package dev.minibook.service;

import dev.minibook.domain.entity.Agent;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.CreatePostRequest;
import dev.minibook.dto.request.UpdatePostRequest;
import dev.minibook.dto.response.PostResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.mention.MentionParser;
import dev.minibook.pipeline.EventPipeline;
import dev.minibook.repository.CommentRepository;
import dev.minibook.repository.PostRepository;
import dev.minibook.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock private ProjectRepository projectRepository;
    @Mock private PostRepository postRepository;
    @Mock private CommentRepository commentRepository;
    @Mock private EventPipeline pipeline;

    private PostService postService;
    private Agent alice;
    private Actor bob;
    private Post post;

    @BeforeEach
    void setUp() {
        postService = new PostService(projectRepository, postRepository, commentRepository,
                new MentionParser(), pipeline);
        alice = Agent.register("alice");
        Agent bobAgent = Agent.register("bob");
        bob = new Actor(bobAgent.getId(), bobAgent.getName());
        post = Post.create(UUID.randomUUID(), alice, "Title", "body", null, List.of("a"), Set.of());
    }

    @Test
    @DisplayName("creating a post in a missing project never reaches the pipeline")
    void createInMissingProject() {
        UUID projectId = UUID.randomUUID();
        when(projectRepository.existsById(projectId)).thenReturn(false);

        assertThatThrownBy(() -> postService.create(bob, projectId, new CreatePostRequest("t", "c", null, null)))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(pipeline);
    }

    @Nested
    @DisplayName("update")
    class Update {

        @BeforeEach
        void found() {
            when(postRepository.findWithAuthorById(post.getId())).thenReturn(Optional.of(post));
        }

        @Test
        @DisplayName("applies only the fields that are present")
        void partial() {
            PostResponse response = postService.update(bob, post.getId(),
                    new UpdatePostRequest(null, null, null, true, null));

            assertThat(response.title()).isEqualTo("Title");
            assertThat(response.content()).isEqualTo("body");
            assertThat(response.tags()).containsExactly("a");
            assertThat(response.pinned()).isTrue();
            assertThat(response.authorName()).isEqualTo("alice");
        }

        @Test
        @DisplayName("new content re-extracts mentions")
        void reextractsMentions() {
            PostResponse response = postService.update(bob, post.getId(),
                    new UpdatePostRequest(null, "now with @carol and @dave", null, null, null));

            assertThat(response.mentions()).containsExactly("carol", "dave");
        }

        @Test
        @DisplayName("hands old and new status to the status-change pipeline")
        void statusChange() {
            postService.update(bob, post.getId(), new UpdatePostRequest(null, null, "resolved", null, null));

            assertThat(post.getStatus()).isEqualTo("resolved");
            verify(pipeline).runStatusChangePipeline(post, "open", "resolved", bob);
        }

        @Test
        @DisplayName("without a status the pipeline sees null as the new status")
        void noStatus() {
            postService.update(bob, post.getId(), new UpdatePostRequest("New", null, null, null, null));

            verify(pipeline).runStatusChangePipeline(post, "open", null, bob);
        }
    }

    @Nested
    @DisplayName("addComment")
    class AddComment {

        @Test
        @DisplayName("rejects a parent comment from another post")
        void foreignParent() {
            UUID parentId = UUID.randomUUID();
            when(postRepository.findWithAuthorById(post.getId())).thenReturn(Optional.of(post));
            when(commentRepository.existsByIdAndPostId(parentId, post.getId())).thenReturn(false);

            assertThatThrownBy(() -> postService.addComment(bob, post.getId(), parentId, "hi"))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(pipeline, never()).runCommentPipeline(any(), any(), any(), any());
        }

        @Test
        @DisplayName("a missing post is a 404")
        void missingPost() {
            UUID postId = UUID.randomUUID();
            when(postRepository.findWithAuthorById(postId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> postService.addComment(bob, postId, null, "hi"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage("Post not found");
        }
    }
}
