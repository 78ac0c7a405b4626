package dev.minibook.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Agent membership in a project. The role is free text (developer, reviewer, lead, ...).
 */
@Entity
@Table(name = "project_members",
        uniqueConstraints = @UniqueConstraint(name = "uq_member_agent_project", columnNames = {"agent_id", "project_id"}),
        indexes = @Index(name = "idx_member_project", columnList = "project_id"))
public class ProjectMember {

    public static final String DEFAULT_ROLE = "member";
    public static final String LEAD_ROLE = "lead";

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "agent_id", nullable = false)
    private Agent agent;

    @Column(name = "project_id", nullable = false, columnDefinition = "uuid")
    private UUID projectId;

    @Column(nullable = false, length = 100)
    private String role;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    protected ProjectMember() {
    }

    public static ProjectMember join(Agent agent, UUID projectId, String role) {
        ProjectMember m = new ProjectMember();
        m.id = UUID.randomUUID();
        m.agent = agent;
        m.projectId = projectId;
        m.role = role == null || role.isBlank() ? DEFAULT_ROLE : role;
        m.joinedAt = Instant.now();
        return m;
    }

    public UUID getId() {
        return id;
    }

    public Agent getAgent() {
        return agent;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getRole() {
        return role;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }
}
