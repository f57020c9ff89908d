package com.yamdb.backend.modules.catalog.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.modules.catalog.domain.Genre;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GenreRepository extends JpaRepository<Genre, UUID> {

    Optional<Genre> findBySlug(String slug);

    Optional<Genre> findByName(String name);

    List<Genre> findBySlugIn(Collection<String> slugs);

    Page<Genre> findByNameContainingIgnoreCase(String name, Pageable pageable);
}
