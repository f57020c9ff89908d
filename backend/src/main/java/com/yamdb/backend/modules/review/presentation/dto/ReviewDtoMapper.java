package com.yamdb.backend.modules.review.presentation.dto;

import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.review.domain.Comment;
import com.yamdb.backend.modules.review.domain.Review;

public final class ReviewDtoMapper {

    private ReviewDtoMapper() {
    }

    public static ReviewResponse toResponse(Review review) {
        return new ReviewResponse(
                review.getId(),
                review.getTitle().getId(),
                authorName(review.getAuthor()),
                review.getText(),
                review.getScore(),
                review.getCreatedAt()
        );
    }

    public static CommentResponse toResponse(Comment comment) {
        return new CommentResponse(
                comment.getId(),
                comment.getReview().getId(),
                authorName(comment.getAuthor()),
                comment.getText(),
                comment.getCreatedAt()
        );
    }

    private static String authorName(YamdbUser author) {
        return author != null ? author.getUsername() : null;
    }
}
