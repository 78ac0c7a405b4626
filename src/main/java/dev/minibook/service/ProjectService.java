package dev.minibook.service;

import dev.minibook.domain.entity.Project;
import dev.minibook.domain.entity.ProjectMember;
import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.response.MemberResponse;
import dev.minibook.dto.response.ProjectResponse;
import dev.minibook.exception.NotFoundException;
import dev.minibook.repository.AgentRepository;
import dev.minibook.repository.ProjectMemberRepository;
import dev.minibook.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;
    private final AgentRepository agentRepository;

    public ProjectService(ProjectRepository projectRepository,
                          ProjectMemberRepository memberRepository,
                          AgentRepository agentRepository) {
        this.projectRepository = projectRepository;
        this.memberRepository = memberRepository;
        this.agentRepository = agentRepository;
    }

    /** Creates the project; the creator joins it as lead. */
    @Transactional
    public ProjectResponse create(Actor actor, String name, String description) {
        if (projectRepository.existsByName(name)) {
            throw new IllegalArgumentException("Project name already taken");
        }
        Project project = projectRepository.save(Project.create(name, description));
        memberRepository.save(ProjectMember.join(
                agentRepository.getReferenceById(actor.id()), project.getId(), ProjectMember.LEAD_ROLE));
        log.info("Project {} ({}) created by {}", project.getName(), project.getId(), actor.name());
        return toResponse(project);
    }

    @Transactional(readOnly = true)
    public List<ProjectResponse> list() {
        return projectRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(ProjectService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProjectResponse get(UUID projectId) {
        return projectRepository.findById(projectId)
                .map(ProjectService::toResponse)
                .orElseThrow(() -> NotFoundException.of("Project"));
    }

    @Transactional
    public MemberResponse join(Actor actor, UUID projectId, String role) {
        requireProject(projectId);
        if (memberRepository.existsByAgentIdAndProjectId(actor.id(), projectId)) {
            throw new IllegalArgumentException("Already a member");
        }
        ProjectMember member = memberRepository.save(ProjectMember.join(
                agentRepository.getReferenceById(actor.id()), projectId, role));
        log.info("{} joined project {} as {}", actor.name(), projectId, member.getRole());
        return new MemberResponse(actor.id(), actor.name(), member.getRole(), member.getJoinedAt());
    }

    @Transactional(readOnly = true)
    public List<MemberResponse> members(UUID projectId) {
        requireProject(projectId);
        return memberRepository.findByProjectIdOrderByJoinedAtAsc(projectId).stream()
                .map(m -> new MemberResponse(m.getAgent().getId(), m.getAgent().getName(), m.getRole(), m.getJoinedAt()))
                .toList();
    }

    private void requireProject(UUID projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project");
        }
    }

    private static ProjectResponse toResponse(Project project) {
        return new ProjectResponse(project.getId(), project.getName(), project.getDescription(), project.getCreatedAt());
    }
}
