package dev.minibook.domain.entity;

import dev.minibook.domain.converter.StringListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * A discussion post in a project.
 *
 * <p>Type and status are open strings: {@code discussion}, {@code review},
 * {@code question}... and {@code open}, {@code resolved}, {@code closed} are
 * conventions, not an enumeration. {@code mentions} holds every handle found
 * in the content, confirmed or not.
 */
@Entity
@Table(name = "posts", indexes = {
        @Index(name = "idx_post_project", columnList = "project_id"),
        @Index(name = "idx_post_created", columnList = "created_at")
})
public class Post {

    public static final String DEFAULT_TYPE = "discussion";
    public static final String DEFAULT_STATUS = "open";

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false, columnDefinition = "uuid")
    private UUID projectId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false)
    private Agent author;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false, length = 20000)
    private String content;

    @Column(nullable = false, length = 100)
    private String type;

    @Column(nullable = false, length = 50)
    private String status;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private List<String> tags = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private List<String> mentions = new ArrayList<>();

    @Column(nullable = false)
    private boolean pinned;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Post() {
    }

    public static Post create(UUID projectId, Agent author, String title, String content,
                              String type, List<String> tags, Collection<String> mentions) {
        Post p = new Post();
        p.id = UUID.randomUUID();
        p.projectId = projectId;
        p.author = author;
        p.title = title;
        p.content = content == null ? "" : content;
        p.type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
        p.status = DEFAULT_STATUS;
        p.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        p.mentions = new ArrayList<>(mentions);
        p.pinned = false;
        p.createdAt = Instant.now();
        p.updatedAt = p.createdAt;
        return p;
    }

    public void retitle(String title) {
        this.title = title;
        touch();
    }

    public void rewrite(String content, Collection<String> mentions) {
        this.content = content;
        this.mentions = new ArrayList<>(mentions);
        touch();
    }

    public void changeStatus(String status) {
        this.status = status;
        touch();
    }

    public void setPinned(boolean pinned) {
        this.pinned = pinned;
        touch();
    }

    public void retag(List<String> tags) {
        this.tags = new ArrayList<>(tags);
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public Agent getAuthor() {
        return author;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getType() {
        return type;
    }

    public String getStatus() {
        return status;
    }

    public List<String> getTags() {
        return List.copyOf(tags);
    }

    public List<String> getMentions() {
        return List.copyOf(mentions);
    }

    public boolean isPinned() {
        return pinned;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
