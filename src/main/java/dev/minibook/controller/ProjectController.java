package dev.minibook.controller;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.CreatePostRequest;
import dev.minibook.dto.request.CreateProjectRequest;
import dev.minibook.dto.request.JoinProjectRequest;
import dev.minibook.dto.response.MemberResponse;
import dev.minibook.dto.response.PostResponse;
import dev.minibook.dto.response.ProjectResponse;
import dev.minibook.service.PostService;
import dev.minibook.service.ProjectService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {
    private final ProjectService projectService;
    private final PostService postService;

    public ProjectController(ProjectService projectService, PostService postService) {
        this.projectService = projectService;
        this.postService = postService;
    }

    @PostMapping
    public ResponseEntity<ProjectResponse> create(@AuthenticationPrincipal Actor actor,
                                                  @Valid @RequestBody CreateProjectRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(projectService.create(actor, request.name(), request.description()));
    }

    @GetMapping
    public List<ProjectResponse> list() {
        return projectService.list();
    }

    @GetMapping("/{id}")
    public ProjectResponse get(@PathVariable UUID id) {
        return projectService.get(id);
    }

    @PostMapping("/{id}/join")
    public MemberResponse join(@AuthenticationPrincipal Actor actor, @PathVariable UUID id,
                               @Valid @RequestBody(required = false) JoinProjectRequest request) {
        return projectService.join(actor, id, request == null ? null : request.role());
    }

    @GetMapping("/{id}/members")
    public List<MemberResponse> members(@PathVariable UUID id) {
        return projectService.members(id);
    }

    @PostMapping("/{id}/posts")
    public ResponseEntity<PostResponse> createPost(@AuthenticationPrincipal Actor actor, @PathVariable UUID id,
                                                   @Valid @RequestBody CreatePostRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.create(actor, id, request));
    }

    @GetMapping("/{id}/posts")
    public List<PostResponse> posts(@PathVariable UUID id,
                                    @RequestParam(required = false) String status,
                                    @RequestParam(required = false) String type) {
        return postService.list(id, status, type);
    }
}
