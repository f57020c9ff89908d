package com.yamdb.backend.modules.review.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.catalog.domain.Title;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.PolicyAction;
import com.yamdb.backend.modules.review.domain.Review;
import com.yamdb.backend.modules.review.infrastructure.persistence.CommentRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;
import com.yamdb.backend.modules.review.presentation.dto.CreateReviewRequest;
import com.yamdb.backend.modules.review.presentation.dto.ReviewDtoMapper;
import com.yamdb.backend.modules.review.presentation.dto.ReviewResponse;
import com.yamdb.backend.modules.review.presentation.dto.UpdateReviewRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Review ledger. Every write takes the title row lock first so the one-review-per-author rule and the
 * rating recomputation are serialized per title.
 */
@Service
@Transactional
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);
    private static final String UNIQUE_REVIEW_CONSTRAINT = "uq_review_title_author";

    private final ReviewRepository reviewRepository;
    private final CommentRepository commentRepository;
    private final TitleRepository titleRepository;
    private final YamdbUserRepository userRepository;
    private final TitleRatingService titleRatingService;
    private final PolicyEnforcer policyEnforcer;
    private final AuditLogService auditLogService;

    public ReviewService(
            ReviewRepository reviewRepository,
            CommentRepository commentRepository,
            TitleRepository titleRepository,
            YamdbUserRepository userRepository,
            TitleRatingService titleRatingService,
            PolicyEnforcer policyEnforcer,
            AuditLogService auditLogService
    ) {
        this.reviewRepository = reviewRepository;
        this.commentRepository = commentRepository;
        this.titleRepository = titleRepository;
        this.userRepository = userRepository;
        this.titleRatingService = titleRatingService;
        this.policyEnforcer = policyEnforcer;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public PageResponse<ReviewResponse> listReviews(UUID titleId, Pageable pageable) {
        if (!titleRepository.existsById(titleId)) {
            throw new ProblemException(ErrorKind.NOT_FOUND, "catalog.title_not_found", "Title not found");
        }
        Page<Review> page = reviewRepository.findByTitle_Id(titleId, pageable);
        return PageResponse.of(page, ReviewDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public ReviewResponse getReview(UUID titleId, UUID reviewId) {
        return ReviewDtoMapper.toResponse(reviewRepository.findByIdAndTitle_Id(reviewId, titleId)
                .orElseThrow(ReviewService::reviewNotFound));
    }

    public ReviewResponse createReview(Actor actor, UUID titleId, CreateReviewRequest request) {
        policyEnforcer.require(actor, PolicyAction.CREATE_CONTENT);
        String text = requireText(request.text());
        int score = requireScore(request.score());

        Title title = titleRepository.findByIdForUpdate(titleId)
                .orElseThrow(() -> new ProblemException(ErrorKind.VALIDATION, "title_not_found",
                        "Cannot review a title that does not exist"));
        YamdbUser author = userRepository.findById(actor.userId())
                .orElseThrow(() -> new ProblemException(ErrorKind.UNAUTHENTICATED, "auth.account_missing",
                        "The account behind this token no longer exists"));
        if (reviewRepository.existsByTitle_IdAndAuthor_Id(titleId, author.getId())) {
            throw duplicateReview();
        }

        Review review = new Review();
        review.setTitle(title);
        review.setAuthor(author);
        review.setText(text);
        review.setScore(score);
        Review saved;
        try {
            saved = reviewRepository.saveAndFlush(review);
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueReviewViolation(ex)) {
                throw duplicateReview();
            }
            throw ex;
        }
        titleRatingService.recompute(titleId);
        return ReviewDtoMapper.toResponse(saved);
    }

    public ReviewResponse updateReview(Actor actor, UUID titleId, UUID reviewId, UpdateReviewRequest request) {
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, true);
        Review review = lockAndLoad(titleId, reviewId);
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, review.isAuthoredBy(actor.userId()));

        if (request.text() != null) {
            review.setText(requireText(request.text()));
        }
        if (request.score() != null) {
            review.setScore(requireScore(request.score()));
        }
        Review saved = reviewRepository.saveAndFlush(review);
        titleRatingService.recompute(titleId);
        return ReviewDtoMapper.toResponse(saved);
    }

    /**
     * Removes the review's comments, then the review, then recomputes the rating.
     */
    public void deleteReview(Actor actor, UUID titleId, UUID reviewId) {
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, true);
        Review review = lockAndLoad(titleId, reviewId);
        boolean owner = review.isAuthoredBy(actor.userId());
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, owner);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("titleId", titleId.toString());
        detail.put("author", review.getAuthor() != null ? review.getAuthor().getUsername() : null);
        detail.put("score", review.getScore());

        int comments = commentRepository.deleteByReviewId(reviewId);
        reviewRepository.deleteById(reviewId);
        titleRatingService.recompute(titleId);

        if (!owner) {
            detail.put("commentsDeleted", comments);
            auditLogService.record(new AuditLogCommand("REVIEW_MODERATED_DELETE", "REVIEW", reviewId.toString(),
                    actor.userId(), detail));
            log.info("User {} removed review {} on title {}", actor.username(), reviewId, titleId);
        }
    }

    private Review lockAndLoad(UUID titleId, UUID reviewId) {
        UUID owningTitle = reviewRepository.findTitleIdById(reviewId).orElseThrow(ReviewService::reviewNotFound);
        if (!owningTitle.equals(titleId)) {
            throw reviewNotFound();
        }
        titleRepository.findByIdForUpdate(titleId).orElseThrow(ReviewService::reviewNotFound);
        // re-read under the lock; a concurrent delete may have won
        return reviewRepository.findByIdAndTitle_Id(reviewId, titleId).orElseThrow(ReviewService::reviewNotFound);
    }

    static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ProblemException(ErrorKind.VALIDATION, "review.text_required", "text must not be blank");
        }
        return text.trim();
    }

    static int requireScore(Integer score) {
        if (score == null || score < Review.MIN_SCORE || score > Review.MAX_SCORE) {
            throw new ProblemException(ErrorKind.VALIDATION, "review.score_out_of_range",
                    "score must be between " + Review.MIN_SCORE + " and " + Review.MAX_SCORE);
        }
        return score;
    }

    private static boolean isUniqueReviewViolation(DataIntegrityViolationException ex) {
        String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
        return message != null && message.contains(UNIQUE_REVIEW_CONSTRAINT);
    }

    private static ProblemException duplicateReview() {
        return new ProblemException(ErrorKind.CONFLICT, "review.already_exists", "You have already reviewed this title");
    }

    private static ProblemException reviewNotFound() {
        return new ProblemException(ErrorKind.NOT_FOUND, "review.not_found", "Review not found");
    }
}
