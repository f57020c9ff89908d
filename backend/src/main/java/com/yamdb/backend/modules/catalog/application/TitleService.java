package com.yamdb.backend.modules.catalog.application;

import java.time.Clock;
import java.time.Year;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.catalog.domain.CatalogRules;
import com.yamdb.backend.modules.catalog.domain.Category;
import com.yamdb.backend.modules.catalog.domain.Genre;
import com.yamdb.backend.modules.catalog.domain.Title;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.GenreRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleSearchCondition;
import com.yamdb.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.yamdb.backend.modules.catalog.presentation.dto.CreateTitleRequest;
import com.yamdb.backend.modules.catalog.presentation.dto.TitleResponse;
import com.yamdb.backend.modules.catalog.presentation.dto.UpdateTitleRequest;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.PolicyAction;
import com.yamdb.backend.modules.review.infrastructure.persistence.CommentRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class TitleService {

    private static final Logger log = LoggerFactory.getLogger(TitleService.class);

    private final TitleRepository titleRepository;
    private final CategoryRepository categoryRepository;
    private final GenreRepository genreRepository;
    private final ReviewRepository reviewRepository;
    private final CommentRepository commentRepository;
    private final PolicyEnforcer policyEnforcer;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public TitleService(
            TitleRepository titleRepository,
            CategoryRepository categoryRepository,
            GenreRepository genreRepository,
            ReviewRepository reviewRepository,
            CommentRepository commentRepository,
            PolicyEnforcer policyEnforcer,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.titleRepository = titleRepository;
        this.categoryRepository = categoryRepository;
        this.genreRepository = genreRepository;
        this.reviewRepository = reviewRepository;
        this.commentRepository = commentRepository;
        this.policyEnforcer = policyEnforcer;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PageResponse<TitleResponse> listTitles(TitleSearchCondition condition, Pageable pageable) {
        Page<Title> page = titleRepository.search(condition != null ? condition : TitleSearchCondition.none(), pageable);
        return PageResponse.of(page, CatalogDtoMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public TitleResponse getTitle(UUID titleId) {
        return CatalogDtoMapper.toResponse(titleRepository.findDetailedById(titleId)
                .orElseThrow(TitleService::titleNotFound));
    }

    public TitleResponse createTitle(Actor actor, CreateTitleRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Title title = new Title();
        title.setName(CatalogRules.requireName(request.name()));
        title.setYear(requireYear(request.year()));
        title.setDescription(normalizeDescription(request.description()));
        title.setCategory(resolveCategory(request.category()));
        title.replaceGenres(resolveGenres(request.genres()));
        Title saved = titleRepository.save(title);
        log.debug("Created title {} ({})", saved.getName(), saved.getId());
        return CatalogDtoMapper.toResponse(saved);
    }

    public TitleResponse updateTitle(Actor actor, UUID titleId, UpdateTitleRequest request) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Title title = titleRepository.findByIdForUpdate(titleId).orElseThrow(TitleService::titleNotFound);
        if (request.name() != null) {
            title.setName(CatalogRules.requireName(request.name()));
        }
        if (request.year() != null) {
            title.setYear(requireYear(request.year()));
        }
        if (request.description() != null) {
            title.setDescription(normalizeDescription(request.description()));
        }
        if (request.category() != null) {
            title.setCategory(resolveCategory(request.category()));
        }
        if (request.genres() != null) {
            title.replaceGenres(resolveGenres(request.genres()));
        }
        return CatalogDtoMapper.toResponse(titleRepository.save(title));
    }

    /**
     * Deletes comments, then reviews, then the title, under the title row lock.
     */
    public void deleteTitle(Actor actor, UUID titleId) {
        policyEnforcer.require(actor, PolicyAction.MANAGE_CATALOG);
        Title title = titleRepository.findByIdForUpdate(titleId).orElseThrow(TitleService::titleNotFound);
        int comments = commentRepository.deleteByTitleId(titleId);
        int reviews = reviewRepository.deleteByTitleId(titleId);
        titleRepository.deleteById(titleId);
        titleRepository.flush();
        auditLogService.record(new AuditLogCommand("TITLE_DELETE", "TITLE", titleId.toString(), actor.userId(),
                Map.of("name", title.getName(), "reviewsDeleted", reviews, "commentsDeleted", comments)));
        log.info("Deleted title {} with {} reviews and {} comments", titleId, reviews, comments);
    }

    private int requireYear(Integer year) {
        if (year == null) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.year_required", "year is required");
        }
        int currentYear = Year.now(clock).getValue();
        if (year > currentYear) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.year_in_future",
                    "year must not be later than " + currentYear);
        }
        return year;
    }

    private Category resolveCategory(String slug) {
        if (!StringUtils.hasText(slug)) {
            return null;
        }
        return categoryRepository.findBySlug(slug.trim())
                .orElseThrow(() -> new ProblemException(ErrorKind.VALIDATION, "catalog.category_not_found",
                        "Unknown category slug: " + slug.trim()));
    }

    private Set<Genre> resolveGenres(List<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.genres_required", "At least one genre is required");
        }
        Set<String> wanted = slugs.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (wanted.isEmpty()) {
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.genres_required", "At least one genre is required");
        }
        List<Genre> found = genreRepository.findBySlugIn(wanted);
        if (found.size() != wanted.size()) {
            Set<String> known = found.stream().map(Genre::getSlug).collect(Collectors.toSet());
            String missing = wanted.stream().filter(slug -> !known.contains(slug)).collect(Collectors.joining(", "));
            throw new ProblemException(ErrorKind.VALIDATION, "catalog.genre_not_found", "Unknown genre slug: " + missing);
        }
        return new LinkedHashSet<>(found);
    }

    private static String normalizeDescription(String description) {
        return StringUtils.hasText(description) ? description.trim() : null;
    }

    private static ProblemException titleNotFound() {
        return new ProblemException(ErrorKind.NOT_FOUND, "catalog.title_not_found", "Title not found");
    }
}
