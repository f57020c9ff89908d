package com.yamdb.backend.modules.importer.application;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the CSV import once at startup when {@code app.import.directory} is set.
 */
@Component
@ConditionalOnProperty(name = "app.import.directory")
public class CsvImportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CsvImportRunner.class);

    private final CsvImportService csvImportService;
    private final Path directory;

    public CsvImportRunner(CsvImportService csvImportService, @Value("${app.import.directory}") String directory) {
        this.csvImportService = csvImportService;
        this.directory = Path.of(directory);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Importing CSV data from {}", directory.toAbsolutePath());
        ImportReport report = csvImportService.importDirectory(directory);
        log.info("CSV import created {} and skipped {}", report.getCreated(), report.getSkipped());
    }
}
