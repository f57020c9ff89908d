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
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.PolicyAction;
import com.yamdb.backend.modules.review.domain.Comment;
import com.yamdb.backend.modules.review.domain.Review;
import com.yamdb.backend.modules.review.infrastructure.persistence.CommentRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;
import com.yamdb.backend.modules.review.presentation.dto.CommentRequest;
import com.yamdb.backend.modules.review.presentation.dto.CommentResponse;
import com.yamdb.backend.modules.review.presentation.dto.ReviewDtoMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final ReviewRepository reviewRepository;
    private final YamdbUserRepository userRepository;
    private final PolicyEnforcer policyEnforcer;
    private final AuditLogService auditLogService;

    public CommentService(
            CommentRepository commentRepository,
            ReviewRepository reviewRepository,
            YamdbUserRepository userRepository,
            PolicyEnforcer policyEnforcer,
            AuditLogService auditLogService
    ) {
        this.commentRepository = commentRepository;
        this.reviewRepository = reviewRepository;
        this.userRepository = userRepository;
        this.policyEnforcer = policyEnforcer;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public PageResponse<CommentResponse> listComments(UUID titleId, UUID reviewId, Pageable pageable) {
        requireReview(titleId, reviewId);
        Page<Comment> page = commentRepository.findByReview_Id(reviewId, pageable);
        return PageResponse.of(page, ReviewDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public CommentResponse getComment(UUID titleId, UUID reviewId, UUID commentId) {
        requireReview(titleId, reviewId);
        return ReviewDtoMapper.toResponse(requireComment(reviewId, commentId));
    }

    public CommentResponse createComment(Actor actor, UUID titleId, UUID reviewId, CommentRequest request) {
        policyEnforcer.require(actor, PolicyAction.CREATE_CONTENT);
        String text = requireText(request.text());
        Review review = requireReview(titleId, reviewId);
        YamdbUser author = userRepository.findById(actor.userId())
                .orElseThrow(() -> new ProblemException(ErrorKind.UNAUTHENTICATED, "auth.account_missing",
                        "The account behind this token no longer exists"));

        Comment comment = new Comment();
        comment.setReview(review);
        comment.setAuthor(author);
        comment.setText(text);
        return ReviewDtoMapper.toResponse(commentRepository.saveAndFlush(comment));
    }

    public CommentResponse updateComment(Actor actor, UUID titleId, UUID reviewId, UUID commentId, CommentRequest request) {
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, true);
        requireReview(titleId, reviewId);
        Comment comment = requireComment(reviewId, commentId);
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, comment.isAuthoredBy(actor.userId()));

        comment.setText(requireText(request.text()));
        return ReviewDtoMapper.toResponse(commentRepository.saveAndFlush(comment));
    }

    public void deleteComment(Actor actor, UUID titleId, UUID reviewId, UUID commentId) {
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, true);
        requireReview(titleId, reviewId);
        Comment comment = requireComment(reviewId, commentId);
        boolean owner = comment.isAuthoredBy(actor.userId());
        policyEnforcer.require(actor, PolicyAction.MODIFY_CONTENT, owner);

        commentRepository.delete(comment);
        if (!owner) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("reviewId", reviewId.toString());
            detail.put("author", comment.getAuthor() != null ? comment.getAuthor().getUsername() : null);
            auditLogService.record(new AuditLogCommand("COMMENT_MODERATED_DELETE", "COMMENT", commentId.toString(),
                    actor.userId(), detail));
            log.info("User {} removed comment {} on review {}", actor.username(), commentId, reviewId);
        }
    }

    private Review requireReview(UUID titleId, UUID reviewId) {
        return reviewRepository.findByIdAndTitle_Id(reviewId, titleId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "review.not_found", "Review not found"));
    }

    private Comment requireComment(UUID reviewId, UUID commentId) {
        return commentRepository.findByIdAndReview_Id(commentId, reviewId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "comment.not_found", "Comment not found"));
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ProblemException(ErrorKind.VALIDATION, "comment.text_required", "text must not be blank");
        }
        return text.trim();
    }
}
