package com.yamdb.backend.modules.importer.application;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Year;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.auth.domain.AccountRules;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.catalog.domain.CatalogRules;
import com.yamdb.backend.modules.catalog.domain.Category;
import com.yamdb.backend.modules.catalog.domain.Genre;
import com.yamdb.backend.modules.catalog.domain.Title;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.GenreRepository;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.policy.domain.Role;
import com.yamdb.backend.modules.review.application.TitleRatingService;
import com.yamdb.backend.modules.review.domain.Comment;
import com.yamdb.backend.modules.review.domain.Review;
import com.yamdb.backend.modules.review.infrastructure.persistence.CommentRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Loads the legacy CSV export. Legacy numeric ids only link rows within one run; existing rows are
 * matched by slug, username or natural key and reused.
 */
@Service
public class CsvImportService {

    private static final Logger log = LoggerFactory.getLogger(CsvImportService.class);

    static final String CATEGORY_FILE = "category.csv";
    static final String GENRE_FILE = "genre.csv";
    static final String TITLE_FILE = "titles.csv";
    static final String GENRE_TITLE_FILE = "genre_title.csv";
    static final String USER_FILE = "users.csv";
    static final String REVIEW_FILE = "review.csv";
    static final String COMMENT_FILE = "comments.csv";

    private final CategoryRepository categoryRepository;
    private final GenreRepository genreRepository;
    private final TitleRepository titleRepository;
    private final YamdbUserRepository userRepository;
    private final ReviewRepository reviewRepository;
    private final CommentRepository commentRepository;
    private final TitleRatingService titleRatingService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();

    public CsvImportService(
            CategoryRepository categoryRepository,
            GenreRepository genreRepository,
            TitleRepository titleRepository,
            YamdbUserRepository userRepository,
            ReviewRepository reviewRepository,
            CommentRepository commentRepository,
            TitleRatingService titleRatingService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.categoryRepository = categoryRepository;
        this.genreRepository = genreRepository;
        this.titleRepository = titleRepository;
        this.userRepository = userRepository;
        this.reviewRepository = reviewRepository;
        this.commentRepository = commentRepository;
        this.titleRatingService = titleRatingService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public ImportReport importDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Import directory does not exist: " + directory);
        }
        ImportRun run = new ImportRun();
        ImportReport report = new ImportReport();

        for (Map<String, String> row : readRows(directory, CATEGORY_FILE)) {
            importCategory(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, GENRE_FILE)) {
            importGenre(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, TITLE_FILE)) {
            importTitle(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, GENRE_TITLE_FILE)) {
            importGenreLink(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, USER_FILE)) {
            importUser(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, REVIEW_FILE)) {
            importReview(row, run, report);
        }
        for (Map<String, String> row : readRows(directory, COMMENT_FILE)) {
            importComment(row, run, report);
        }

        for (UUID titleId : run.touchedTitles) {
            titleRepository.findByIdForUpdate(titleId).ifPresent(title -> titleRatingService.recompute(titleId));
        }
        report.setTitlesRecomputed(run.touchedTitles.size());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("directory", directory.toAbsolutePath().toString());
        detail.put("created", new HashMap<>(report.getCreated()));
        detail.put("skipped", new HashMap<>(report.getSkipped()));
        auditLogService.record(new AuditLogCommand("CSV_IMPORT", "IMPORT", String.valueOf(directory.getFileName()), null, detail));
        log.info("CSV import from {} finished: {}", directory, report);
        return report;
    }

    private List<Map<String, String>> readRows(Path directory, String fileName) {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            log.warn("Import file {} not found in {}, skipping", fileName, directory);
            return List.of();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            List<Map<String, String>> result = rows.readAll();
            log.info("Read {} rows from {}", result.size(), fileName);
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + file, ex);
        }
    }

    private void importCategory(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        try {
            String name = CatalogRules.requireName(value(row, "name"));
            String slug = CatalogRules.requireSlug(value(row, "slug"));
            Category category = categoryRepository.findBySlug(slug).orElseGet(() -> {
                Category created = new Category();
                created.setName(name);
                created.setSlug(slug);
                report.recordCreated(CATEGORY_FILE);
                return categoryRepository.saveAndFlush(created);
            });
            run.categories.put(legacyId, category);
        } catch (ProblemException ex) {
            skip(report, CATEGORY_FILE, legacyId, ex.getDetailMessage());
        }
    }

    private void importGenre(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        try {
            String name = CatalogRules.requireName(value(row, "name"));
            String slug = CatalogRules.requireSlug(value(row, "slug"));
            Genre genre = genreRepository.findBySlug(slug).orElseGet(() -> {
                Genre created = new Genre();
                created.setName(name);
                created.setSlug(slug);
                report.recordCreated(GENRE_FILE);
                return genreRepository.saveAndFlush(created);
            });
            run.genres.put(legacyId, genre);
        } catch (ProblemException ex) {
            skip(report, GENRE_FILE, legacyId, ex.getDetailMessage());
        }
    }

    private void importTitle(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        Integer year = parseInt(value(row, "year"));
        if (year == null || year > Year.now(clock).getValue()) {
            skip(report, TITLE_FILE, legacyId, "invalid year " + value(row, "year"));
            return;
        }
        String name;
        try {
            name = CatalogRules.requireName(value(row, "name"));
        } catch (ProblemException ex) {
            skip(report, TITLE_FILE, legacyId, ex.getDetailMessage());
            return;
        }
        String categoryRef = value(row, "category");
        Category category = categoryRef != null ? run.categories.get(categoryRef) : null;
        if (categoryRef != null && category == null) {
            log.warn("{} row {}: unknown category {}, importing without category", TITLE_FILE, legacyId, categoryRef);
        }
        Title title = titleRepository.findFirstByNameAndYear(name, year).orElseGet(() -> {
            Title created = new Title();
            created.setName(name);
            created.setYear(year);
            created.setDescription(value(row, "description"));
            created.setCategory(category);
            report.recordCreated(TITLE_FILE);
            return titleRepository.saveAndFlush(created);
        });
        run.titles.put(legacyId, title);
    }

    private void importGenreLink(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        Title title = run.titles.get(value(row, "title_id"));
        Genre genre = run.genres.get(value(row, "genre_id"));
        if (title == null || genre == null) {
            skip(report, GENRE_TITLE_FILE, legacyId, "unknown title or genre");
            return;
        }
        if (title.getGenres().add(genre)) {
            titleRepository.saveAndFlush(title);
            report.recordCreated(GENRE_TITLE_FILE);
        }
    }

    private void importUser(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        try {
            String username = AccountRules.requireValidUsername(value(row, "username"));
            Optional<YamdbUser> existing = userRepository.findByUsername(username);
            if (existing.isPresent()) {
                run.users.put(legacyId, existing.get());
                return;
            }
            String email = AccountRules.requireValidEmail(value(row, "email"));
            if (userRepository.existsByEmailIgnoreCase(email)) {
                skip(report, USER_FILE, legacyId, "email already used by another account");
                return;
            }
            Role role = parseRole(value(row, "role"));
            if (role == null) {
                skip(report, USER_FILE, legacyId, "invalid role " + value(row, "role"));
                return;
            }
            YamdbUser user = new YamdbUser();
            user.setUsername(username);
            user.setEmail(email);
            user.setRole(role);
            user.setBio(value(row, "bio"));
            user.setFirstName(AccountRules.optionalName("first_name", value(row, "first_name")));
            user.setLastName(AccountRules.optionalName("last_name", value(row, "last_name")));
            run.users.put(legacyId, userRepository.saveAndFlush(user));
            report.recordCreated(USER_FILE);
        } catch (ProblemException ex) {
            skip(report, USER_FILE, legacyId, ex.getDetailMessage());
        }
    }

    private void importReview(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        Title title = run.titles.get(value(row, "title_id"));
        YamdbUser author = run.users.get(value(row, "author"));
        Integer score = parseInt(value(row, "score"));
        String text = value(row, "text");
        if (title == null || author == null) {
            skip(report, REVIEW_FILE, legacyId, "unknown title or author");
            return;
        }
        if (score == null || score < Review.MIN_SCORE || score > Review.MAX_SCORE || text == null) {
            skip(report, REVIEW_FILE, legacyId, "invalid score or empty text");
            return;
        }
        Optional<Review> existing = reviewRepository.findByTitle_IdAndAuthor_Id(title.getId(), author.getId());
        if (existing.isPresent()) {
            log.debug("{} row {}: author already reviewed title, keeping existing review", REVIEW_FILE, legacyId);
            run.reviews.putIfAbsent(legacyId, existing.get());
            return;
        }
        Review review = new Review();
        review.setTitle(title);
        review.setAuthor(author);
        review.setText(text);
        review.setScore(score);
        run.reviews.put(legacyId, reviewRepository.saveAndFlush(review));
        run.touchedTitles.add(title.getId());
        report.recordCreated(REVIEW_FILE);
    }

    private void importComment(Map<String, String> row, ImportRun run, ImportReport report) {
        String legacyId = value(row, "id");
        Review review = run.reviews.get(value(row, "review_id"));
        YamdbUser author = run.users.get(value(row, "author"));
        String text = value(row, "text");
        if (review == null || author == null || text == null) {
            skip(report, COMMENT_FILE, legacyId, "unknown review or author, or empty text");
            return;
        }
        if (commentRepository.existsByReview_IdAndAuthor_IdAndText(review.getId(), author.getId(), text)) {
            return;
        }
        Comment comment = new Comment();
        comment.setReview(review);
        comment.setAuthor(author);
        comment.setText(text);
        commentRepository.saveAndFlush(comment);
        report.recordCreated(COMMENT_FILE);
    }

    private static void skip(ImportReport report, String file, String legacyId, String reason) {
        log.warn("{} row {} skipped: {}", file, legacyId, reason);
        report.recordSkipped(file);
    }

    private static String value(Map<String, String> row, String column) {
        String raw = row.get(column);
        return StringUtils.hasText(raw) ? raw.trim() : null;
    }

    private static Integer parseInt(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Role parseRole(String raw) {
        if (raw == null) {
            return Role.USER;
        }
        try {
            Role role = Role.fromCode(raw);
            return role.isAssignable() ? role : null;
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * Legacy id to entity maps for one run.
     */
    private static final class ImportRun {
        private final Map<String, Category> categories = new HashMap<>();
        private final Map<String, Genre> genres = new HashMap<>();
        private final Map<String, Title> titles = new HashMap<>();
        private final Map<String, YamdbUser> users = new HashMap<>();
        private final Map<String, Review> reviews = new HashMap<>();
        private final Set<UUID> touchedTitles = new LinkedHashSet<>();
    }
}
