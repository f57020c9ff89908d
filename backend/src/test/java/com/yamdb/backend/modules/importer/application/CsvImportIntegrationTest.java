package com.yamdb.backend.modules.importer.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import com.yamdb.backend.global.web.PageResponse;
import com.yamdb.backend.modules.audit.infrastructure.AuditLogRepository;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.catalog.application.TitleService;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleSearchCondition;
import com.yamdb.backend.modules.catalog.presentation.dto.CatalogEntryResponse;
import com.yamdb.backend.modules.catalog.presentation.dto.TitleResponse;
import com.yamdb.backend.modules.policy.domain.Role;
import com.yamdb.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.domain.PageRequest;

@SpringBootTest
class CsvImportIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private CsvImportService csvImportService;

    @Autowired
    private TitleService titleService;

    @Autowired
    private YamdbUserRepository userRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Test
    void importsFixturesOnceAndIsIdempotent() throws Exception {
        Path directory = new ClassPathResource("import").getFile().toPath();

        ImportReport first = csvImportService.importDirectory(directory);

        assertThat(first.created(CsvImportService.CATEGORY_FILE)).isEqualTo(2);
        assertThat(first.created(CsvImportService.GENRE_FILE)).isEqualTo(2);
        assertThat(first.skipped(CsvImportService.GENRE_FILE)).isEqualTo(1);
        assertThat(first.created(CsvImportService.TITLE_FILE)).isEqualTo(2);
        assertThat(first.skipped(CsvImportService.TITLE_FILE)).isEqualTo(1);
        assertThat(first.created(CsvImportService.GENRE_TITLE_FILE)).isEqualTo(3);
        assertThat(first.skipped(CsvImportService.GENRE_TITLE_FILE)).isEqualTo(1);
        assertThat(first.created(CsvImportService.USER_FILE)).isEqualTo(2);
        assertThat(first.skipped(CsvImportService.USER_FILE)).isEqualTo(1);
        assertThat(first.created(CsvImportService.REVIEW_FILE)).isEqualTo(2);
        assertThat(first.skipped(CsvImportService.REVIEW_FILE)).isEqualTo(1);
        assertThat(first.created(CsvImportService.COMMENT_FILE)).isEqualTo(1);
        assertThat(first.skipped(CsvImportService.COMMENT_FILE)).isEqualTo(1);
        assertThat(first.getTitlesRecomputed()).isEqualTo(1);

        TitleResponse feature = findTitle("CSV Imported Feature", 1994);
        assertThat(feature.rating()).isEqualByComparingTo("6.50");
        assertThat(feature.category().slug()).isEqualTo("csv-film");
        assertThat(feature.genres()).extracting(CatalogEntryResponse::slug).containsExactly("csv-comedy", "csv-drama");

        TitleResponse novel = findTitle("CSV Imported Novel", 1869);
        assertThat(novel.rating()).isNull();

        assertThat(userRepository.findByUsername("csv-bob")).map(YamdbUser::getRole).contains(Role.MODERATOR);
        assertThat(userRepository.findByUsername("csv-alice")).map(YamdbUser::getFirstName).contains("Alice");

        ImportReport second = csvImportService.importDirectory(directory);

        assertThat(second.getCreated().values()).allMatch(count -> count == 0);
        assertThat(findTitle("CSV Imported Feature", 1994).rating()).isEqualByComparingTo("6.50");
        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("IMPORT", "import")).hasSize(2);
    }

    @Test
    void missingDirectoryIsRejected() {
        assertThatThrownBy(() -> csvImportService.importDirectory(Path.of("does-not-exist")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private TitleResponse findTitle(String name, int year) {
        PageResponse<TitleResponse> page = titleService.listTitles(
                new TitleSearchCondition(null, null, name, year),
                PageRequest.of(0, 10)
        );
        assertThat(page.items()).hasSize(1);
        return page.items().get(0);
    }
}
