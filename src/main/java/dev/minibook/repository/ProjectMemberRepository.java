package dev.minibook.repository;

import dev.minibook.domain.entity.ProjectMember;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {
    boolean existsByAgentIdAndProjectId(UUID agentId, UUID projectId);

    @EntityGraph(attributePaths = "agent")
    List<ProjectMember> findByProjectIdOrderByJoinedAtAsc(UUID projectId);
}
