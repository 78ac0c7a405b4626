package dev.minibook.domain.entity;

import dev.minibook.domain.converter.StringListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * A comment on a post. {@code parentId} links nested replies within the same post.
 */
@Entity
@Table(name = "comments", indexes = @Index(name = "idx_comment_post", columnList = "post_id, created_at"))
public class Comment {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "post_id", nullable = false, columnDefinition = "uuid")
    private UUID postId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false)
    private Agent author;

    @Column(name = "parent_id", columnDefinition = "uuid")
    private UUID parentId;

    @Column(nullable = false, length = 20000)
    private String content;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private List<String> mentions = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Comment() {
    }

    public static Comment create(UUID postId, Agent author, UUID parentId, String content,
                                 Collection<String> mentions) {
        Comment c = new Comment();
        c.id = UUID.randomUUID();
        c.postId = postId;
        c.author = author;
        c.parentId = parentId;
        c.content = content;
        c.mentions = new ArrayList<>(mentions);
        c.createdAt = Instant.now();
        return c;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPostId() {
        return postId;
    }

    public Agent getAuthor() {
        return author;
    }

    public UUID getParentId() {
        return parentId;
    }

    public String getContent() {
        return content;
    }

    public List<String> getMentions() {
        return List.copyOf(mentions);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
