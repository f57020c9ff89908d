package com.yamdb.backend.modules.catalog.infrastructure.persistence;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.modules.catalog.domain.Title;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TitleRepository extends JpaRepository<Title, UUID>, TitleRepositoryCustom {

    /**
     * Row lock serializing review writes and rating recomputation for one title.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Title t where t.id = :id")
    Optional<Title> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"category", "genres"})
    @Query("select t from Title t where t.id = :id")
    Optional<Title> findDetailedById(@Param("id") UUID id);

    Optional<Title> findFirstByNameAndYear(String name, int year);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Title t set t.rating = :rating where t.id = :id")
    int updateRating(@Param("id") UUID id, @Param("rating") BigDecimal rating);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Title t set t.category = null where t.category.id = :categoryId")
    int clearCategory(@Param("categoryId") UUID categoryId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "delete from title_genre where genre_id = :genreId", nativeQuery = true)
    int unlinkGenre(@Param("genreId") UUID genreId);
}
