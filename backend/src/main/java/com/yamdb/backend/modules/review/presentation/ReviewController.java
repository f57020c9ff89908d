package com.yamdb.backend.modules.review.presentation;

import java.util.UUID;

import com.yamdb.backend.global.security.SecurityUtils;
import com.yamdb.backend.global.web.PageRequests;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.review.application.ReviewService;
import com.yamdb.backend.modules.review.presentation.dto.CreateReviewRequest;
import com.yamdb.backend.modules.review.presentation.dto.ReviewResponse;
import com.yamdb.backend.modules.review.presentation.dto.UpdateReviewRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
@RequestMapping("/titles/{titleId}/reviews")
public class ReviewController {

    private static final Sort OLDEST_FIRST = Sort.by("createdAt").ascending().and(Sort.by("id"));

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<ReviewResponse>> list(
            @PathVariable("titleId") UUID titleId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(reviewService.listReviews(titleId, PageRequests.of(page, size, OLDEST_FIRST)));
    }

    @Operation(summary = "Review a title", description = "One review per user and title; the title rating is recomputed.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Score outside 1-10, blank text or unknown title"),
            @ApiResponse(responseCode = "403", description = "Anonymous caller"),
            @ApiResponse(responseCode = "409", description = "The caller already reviewed this title")
    })
    @PostMapping
    public ResponseEntity<ReviewResponse> create(
            @PathVariable("titleId") UUID titleId,
            @Valid @RequestBody CreateReviewRequest request
    ) {
        return ResponseEntity.status(201).body(reviewService.createReview(SecurityUtils.currentActor(), titleId, request));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> get(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId
    ) {
        return ResponseEntity.ok(reviewService.getReview(titleId, reviewId));
    }

    @PatchMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> update(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId,
            @Valid @RequestBody UpdateReviewRequest request
    ) {
        return ResponseEntity.ok(reviewService.updateReview(SecurityUtils.currentActor(), titleId, reviewId, request));
    }

    @DeleteMapping("/{reviewId}")
    public ResponseEntity<Void> delete(
            @PathVariable("titleId") UUID titleId,
            @PathVariable("reviewId") UUID reviewId
    ) {
        reviewService.deleteReview(SecurityUtils.currentActor(), titleId, reviewId);
        return ResponseEntity.noContent().build();
    }
}
