package dev.minibook.controller;

import dev.minibook.domain.valueobject.Actor;
import dev.minibook.dto.request.CreateCommentRequest;
import dev.minibook.dto.request.UpdatePostRequest;
import dev.minibook.dto.response.CommentResponse;
import dev.minibook.dto.response.PostResponse;
import dev.minibook.service.PostService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/posts")
public class PostController {
    private final PostService postService;

    public PostController(PostService postService) { this.postService = postService; }

    @GetMapping("/{id}")
    public PostResponse get(@PathVariable UUID id) {
        return postService.get(id);
    }

    @PatchMapping("/{id}")
    public PostResponse update(@AuthenticationPrincipal Actor actor, @PathVariable UUID id,
                               @Valid @RequestBody UpdatePostRequest request) {
        return postService.update(actor, id, request);
    }

    @PostMapping("/{id}/comments")
    public ResponseEntity<CommentResponse> comment(@AuthenticationPrincipal Actor actor, @PathVariable UUID id,
                                                   @Valid @RequestBody CreateCommentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(postService.addComment(actor, id, request.parentId(), request.content()));
    }

    @GetMapping("/{id}/comments")
    public List<CommentResponse> comments(@PathVariable UUID id) {
        return postService.comments(id);
    }
}
