package com.yamdb.backend.modules.review.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.modules.review.domain.Review;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReviewRepository extends JpaRepository<Review, UUID> {

    boolean existsByTitle_IdAndAuthor_Id(UUID titleId, UUID authorId);

    Optional<Review> findByTitle_IdAndAuthor_Id(UUID titleId, UUID authorId);

    @EntityGraph(attributePaths = "author")
    Page<Review> findByTitle_Id(UUID titleId, Pageable pageable);

    @EntityGraph(attributePaths = "author")
    Optional<Review> findByIdAndTitle_Id(UUID id, UUID titleId);

    @Query("select r.title.id from Review r where r.id = :id")
    Optional<UUID> findTitleIdById(@Param("id") UUID id);

    /**
     * Database-side mean of the title's scores; null when the title has no reviews.
     */
    @Query("select avg(r.score) from Review r where r.title.id = :titleId")
    Double averageScore(@Param("titleId") UUID titleId);

    long countByTitle_Id(UUID titleId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Review r where r.title.id = :titleId")
    int deleteByTitleId(@Param("titleId") UUID titleId);
}
