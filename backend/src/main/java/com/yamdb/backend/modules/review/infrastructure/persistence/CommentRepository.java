package com.yamdb.backend.modules.review.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.modules.review.domain.Comment;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentRepository extends JpaRepository<Comment, UUID> {

    @EntityGraph(attributePaths = "author")
    Page<Comment> findByReview_Id(UUID reviewId, Pageable pageable);

    @EntityGraph(attributePaths = "author")
    Optional<Comment> findByIdAndReview_Id(UUID id, UUID reviewId);

    boolean existsByReview_IdAndAuthor_IdAndText(UUID reviewId, UUID authorId, String text);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Comment c where c.review.id = :reviewId")
    int deleteByReviewId(@Param("reviewId") UUID reviewId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Comment c where c.review.id in (select r.id from Review r where r.title.id = :titleId)")
    int deleteByTitleId(@Param("titleId") UUID titleId);
}
