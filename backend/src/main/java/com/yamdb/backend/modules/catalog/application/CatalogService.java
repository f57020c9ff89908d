package com.yamdb.backend.modules.catalog.application;

import java.util.Map;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.catalog.domain.CatalogRules;
import com.yamdb.backend.modules.catalog.domain.Category;
import com.yamdb.backend.modules.catalog.domain.Genre;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.GenreRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.yamdb.backend.modules.catalog.presentation.dto.CatalogEntryResponse;
import com.yamdb.backend.modules.catalog.presentation.dto.CreateCatalogEntryRequest;
import com.yamdb.backend.modules.catalog.presentation.dto.UpdateCatalogEntryRequest;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.PolicyAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Categories and genres. Both are addressed by slug and share the same uniqueness rules.
 */
@Service
@Transactional
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CategoryRepository categoryRepository;
    private final GenreRepository genreRepository;
    private final TitleRepository titleRepository;
    private final PolicyEnforcer policyEnforcer;
    private final AuditLogService auditLogService;

    public CatalogService(
            CategoryRepository categoryRepository,
            GenreRepository genreRepository,
            TitleRepository titleRepository,
            PolicyEnforcer policyEnforcer,
            AuditLogService auditLogService
    ) {
        this.categoryRepository = categoryRepository;
        this.genreRepository = genreRepository;
        this.titleRepository = titleRepository;
        this.policyEnforcer = policyEnforcer;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public PageResponse<CatalogEntryResponse> listCategories(String search, Pageable pageable) {
        Page<Category> page = categoryRepository.findByNameContainingIgnoreCase(searchTerm(search), pageable);
        return PageResponse.of(page, CatalogDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public CatalogEntryResponse getCategory(String slug) {
        return CatalogDtoMapper.toResponse(requireCategory(slug));
    }

    public CatalogEntryResponse createCategory(Actor actor, CreateCatalogEntryRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        String name = CatalogRules.requireName(request.name());
        String slug = CatalogRules.requireSlug(request.slug());
        if (categoryRepository.findBySlug(slug).isPresent()) {
            throw duplicate("category", "slug");
        }
        if (categoryRepository.findByName(name).isPresent()) {
            throw duplicate("category", "name");
        }
        Category category = new Category();
        category.setName(name);
        category.setSlug(slug);
        return CatalogDtoMapper.toResponse(saveUnique(categoryRepository, category, "category"));
    }

    public CatalogEntryResponse updateCategory(Actor actor, String slug, UpdateCatalogEntryRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Category category = requireCategory(slug);
        if (request.name() != null) {
            String name = CatalogRules.requireName(request.name());
            categoryRepository.findByName(name)
                    .filter(other -> !other.getId().equals(category.getId()))
                    .ifPresent(other -> {
                        throw duplicate("category", "name");
                    });
            category.setName(name);
        }
        if (request.slug() != null) {
            String newSlug = CatalogRules.requireSlug(request.slug());
            categoryRepository.findBySlug(newSlug)
                    .filter(other -> !other.getId().equals(category.getId()))
                    .ifPresent(other -> {
                        throw duplicate("category", "slug");
                    });
            category.setSlug(newSlug);
        }
        return CatalogDtoMapper.toResponse(saveUnique(categoryRepository, category, "category"));
    }

    /**
     * Titles of the deleted category keep existing with no category.
     */
    public void deleteCategory(Actor actor, String slug) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Category category = requireCategory(slug);
        int detached = titleRepository.clearCategory(category.getId());
        categoryRepository.deleteById(category.getId());
        auditLogService.record(new AuditLogCommand("CATEGORY_DELETE", "CATEGORY", category.getId().toString(),
                actor.userId(), Map.of("slug", category.getSlug(), "titlesDetached", detached)));
        log.info("Deleted category {} ({} titles detached)", category.getSlug(), detached);
    }

    @Transactional(readOnly = true)
    public PageResponse<CatalogEntryResponse> listGenres(String search, Pageable pageable) {
        Page<Genre> page = genreRepository.findByNameContainingIgnoreCase(searchTerm(search), pageable);
        return PageResponse.of(page, CatalogDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public CatalogEntryResponse getGenre(String slug) {
        return CatalogDtoMapper.toResponse(requireGenre(slug));
    }

    public CatalogEntryResponse createGenre(Actor actor, CreateCatalogEntryRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        String name = CatalogRules.requireName(request.name());
        String slug = CatalogRules.requireSlug(request.slug());
        if (genreRepository.findBySlug(slug).isPresent()) {
            throw duplicate("genre", "slug");
        }
        if (genreRepository.findByName(name).isPresent()) {
            throw duplicate("genre", "name");
        }
        Genre genre = new Genre();
        genre.setName(name);
        genre.setSlug(slug);
        return CatalogDtoMapper.toResponse(saveUnique(genreRepository, genre, "genre"));
    }

    public CatalogEntryResponse updateGenre(Actor actor, String slug, UpdateCatalogEntryRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Genre genre = requireGenre(slug);
        if (request.name() != null) {
            String name = CatalogRules.requireName(request.name());
            genreRepository.findByName(name)
                    .filter(other -> !other.getId().equals(genre.getId()))
                    .ifPresent(other -> {
                        throw duplicate("genre", "name");
                    });
            genre.setName(name);
        }
        if (request.slug() != null) {
            String newSlug = CatalogRules.requireSlug(request.slug());
            genreRepository.findBySlug(newSlug)
                    .filter(other -> !other.getId().equals(genre.getId()))
                    .ifPresent(other -> {
                        throw duplicate("genre", "slug");
                    });
            genre.setSlug(newSlug);
        }
        return CatalogDtoMapper.toResponse(saveUnique(genreRepository, genre, "genre"));
    }

    /**
     * Removes only the genre's title links; the titles stay.
     */
    public void deleteGenre(Actor actor, String slug) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Genre genre = requireGenre(slug);
        int unlinked = titleRepository.unlinkGenre(genre.getId());
        genreRepository.deleteById(genre.getId());
        auditLogService.record(new AuditLogCommand("GENRE_DELETE", "GENRE", genre.getId().toString(),
                actor.userId(), Map.of("slug", genre.getSlug(), "linksRemoved", unlinked)));
        log.info("Deleted genre {} ({} title links removed)", genre.getSlug(), unlinked);
    }

    private Category requireCategory(String slug) {
        return categoryRepository.findBySlug(slug)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "catalog.category_not_found", "Category not found"));
    }

    private Genre requireGenre(String slug) {
        return genreRepository.findBySlug(slug)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "catalog.genre_not_found", "Genre not found"));
    }

    private static String searchTerm(String search) {
        return StringUtils.hasText(search) ? search.trim() : "";
    }

    private static <T> T saveUnique(JpaRepository<T, ?> repository, T entity, String kind) {
        try {
            return repository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException ex) {
            String message = String.valueOf(NestedExceptionUtils.getMostSpecificCause(ex).getMessage());
            if (message.contains("uq_" + kind + "_slug")) {
                throw duplicate(kind, "slug");
            }
            if (message.contains("uq_" + kind + "_name")) {
                throw duplicate(kind, "name");
            }
            throw ex;
        }
    }

    private static ProblemException duplicate(String kind, String field) {
        return new ProblemException(ErrorKind.CONFLICT, "catalog." + kind + "_" + field + "_taken",
                "A " + kind + " with this " + field + " already exists");
    }
}
