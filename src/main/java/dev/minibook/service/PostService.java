package dev.minibook.service;

import dev.minibook.domain.entity.Comment;
import dev.minibook.domain.entity.Post;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.CreatePostRequest;
import dev.minibook.dto.request.UpdatePostRequest;
import dev.minibook.dto.response.CommentResponse;
import dev.minibook.dto.response.PostResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.mention.MentionParser;
import dev.minibook.pipeline.EventPipeline;
import dev.minibook.repository.CommentRepository;
import dev.minibook.repository.PostRepository;
import dev.minibook.repository.ProjectRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Posts and comments. Writes go through {@link EventPipeline}; this class only
 * validates references and maps entities to responses.
 */
@Service
public class PostService {

    private final ProjectRepository projectRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final MentionParser mentionParser;
    private final EventPipeline pipeline;

    public PostService(ProjectRepository projectRepository,
                       PostRepository postRepository,
                       CommentRepository commentRepository,
                       MentionParser mentionParser,
                       EventPipeline pipeline) {
        this.projectRepository = projectRepository;
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
        this.mentionParser = mentionParser;
        this.pipeline = pipeline;
    }

    @Transactional
    public PostResponse create(Actor actor, UUID projectId, CreatePostRequest request) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project");
        }
        Post post = pipeline.runPostPipeline(actor, projectId, request.title(), request.content(),
                request.type(), request.tags());
        return toResponse(post, actor.name());
    }

    @Transactional(readOnly = true)
    public List<PostResponse> list(UUID projectId, String status, String type) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project");
        }
        return postRepository.findForProject(projectId, blankToNull(status), blankToNull(type)).stream()
                .map(p -> toResponse(p, p.getAuthor().getName()))
                .toList();
    }

    @Transactional(readOnly = true)
    public PostResponse get(UUID postId) {
        Post post = requirePost(postId);
        return toResponse(post, post.getAuthor().getName());
    }

    /**
     * Applies the non-null fields. Anyone authenticated may edit a post.
     * New content re-extracts mentions but does not notify.
     */
    @Transactional
    public PostResponse update(Actor actor, UUID postId, UpdatePostRequest request) {
        Post post = requirePost(postId);
        String oldStatus = post.getStatus();

        if (request.title() != null) {
            post.retitle(request.title());
        }
        if (request.content() != null) {
            post.rewrite(request.content(), mentionParser.extract(request.content()));
        }
        if (request.status() != null) {
            post.changeStatus(request.status());
        }
        if (request.pinned() != null) {
            post.setPinned(request.pinned());
        }
        if (request.tags() != null) {
            post.retag(request.tags());
        }

        pipeline.runStatusChangePipeline(post, oldStatus, request.status(), actor);
        return toResponse(post, post.getAuthor().getName());
    }

    @Transactional
    public CommentResponse addComment(Actor actor, UUID postId, UUID parentId, String content) {
        Post post = requirePost(postId);
        if (parentId != null && !commentRepository.existsByIdAndPostId(parentId, postId)) {
            throw new IllegalArgumentException("Parent comment does not belong to this post");
        }
        Comment comment = pipeline.runCommentPipeline(actor, post, parentId, content);
        return toResponse(comment, actor.name());
    }

    @Transactional(readOnly = true)
    public List<CommentResponse> comments(UUID postId) {
        if (!postRepository.existsById(postId)) {
            throw NotFoundException.of("Post");
        }
        return commentRepository.findByPostIdOrderByCreatedAtAsc(postId).stream()
                .map(c -> toResponse(c, c.getAuthor().getName()))
                .toList();
    }

    private Post requirePost(UUID postId) {
        return postRepository.findWithAuthorById(postId).orElseThrow(() -> NotFoundException.of("Post"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static PostResponse toResponse(Post p, String authorName) {
        return new PostResponse(p.getId(), p.getProjectId(), p.getAuthor().getId(), authorName,
                p.getTitle(), p.getContent(), p.getType(), p.getStatus(),
                List.copyOf(p.getTags()), List.copyOf(p.getMentions()), p.isPinned(),
                p.getCreatedAt(), p.getUpdatedAt());
    }

    private static CommentResponse toResponse(Comment c, String authorName) {
        return new CommentResponse(c.getId(), c.getPostId(), c.getAuthor().getId(), authorName,
                c.getParentId(), c.getContent(), List.copyOf(c.getMentions()), c.getCreatedAt());
    }
}
