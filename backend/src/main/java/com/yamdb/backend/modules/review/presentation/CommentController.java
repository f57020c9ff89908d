package com.yamdb.backend.modules.review.presentation;

import java.util.UUID;

import com.yamdb.backend.global.security.SecurityUtils;
import com.yamdb.backend.global.web.PageRequests;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.review.application.CommentService;
import com.yamdb.backend.modules.review.presentation.dto.CommentRequest;
import com.yamdb.backend.modules.review.presentation.dto.CommentResponse;

import jakarta.validation.Valid;

import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/titles/{titleId}/reviews/{reviewId}/comments")
public class CommentController {

    private static final Sort OLDEST_FIRST = Sort.by("createdAt").ascending().and(Sort.by("id"));

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<CommentResponse>> list(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(commentService.listComments(titleId, reviewId, PageRequests.of(page, size, OLDEST_FIRST)));
    }

    @PostMapping
    public ResponseEntity<CommentResponse> create(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @Valid @RequestBody CommentRequest request
    ) {
        return ResponseEntity.status(201)
                .body(commentService.createComment(SecurityUtils.currentActor(), titleId, reviewId, request));
    }

    @GetMapping("/{commentId}")
    public ResponseEntity<CommentResponse> get(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @PathVariable("commentId") UUID commentId
    ) {
        return ResponseEntity.ok(commentService.getComment(titleId, reviewId, commentId));
    }

    @PatchMapping("/{commentId}")
    public ResponseEntity<CommentResponse> update(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @PathVariable("commentId") UUID commentId,
            @Valid @RequestBody CommentRequest request
    ) {
        return ResponseEntity.ok(commentService.updateComment(SecurityUtils.currentActor(), titleId, reviewId, commentId, request));
    }

    @DeleteMapping("/{commentId}")
    public ResponseEntity<Void> delete(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @PathVariable("commentId") UUID commentId
    ) {
        commentService.deleteComment(SecurityUtils.currentActor(), titleId, reviewId, commentId);
        return ResponseEntity.noContent().build();
    }
}
