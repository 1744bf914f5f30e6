package com.example.CourseRag.ingest;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.CourseRagException;
import com.example.CourseRag.model.ChunkedCourse;
import com.example.CourseRag.model.IngestionReport;
import com.example.CourseRag.repository.CourseIndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Loads the configured transcript directory once at startup, after every bean is created and
 * before the web server starts accepting requests. Courses already indexed are skipped; a
 * document that cannot be read or parsed is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseIngestionService implements SmartInitializingSingleton {

    private final CourseDocumentChunker chunker;
    private final CourseIndexStore indexStore;
    private final RagProperties properties;

    @Override
    public void afterSingletonsInstantiated() {
        IngestionReport report = loadDirectory(Path.of(properties.getDocsPath()));
        log.info("Startup ingestion finished: {} added, {} skipped, {} failed, {} chunks",
                report.added(), report.skipped(), report.failed(), report.chunks());
    }

    public IngestionReport loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Course document directory {} does not exist, nothing to load", directory.toAbsolutePath());
            return IngestionReport.empty();
        }

        List<Path> documents;
        try (Stream<Path> files = Files.list(directory)) {
            documents = files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Cannot list course documents in {}", directory, e);
            return IngestionReport.empty();
        }

        int added = 0;
        int skipped = 0;
        int failed = 0;
        int chunks = 0;
        for (Path document : documents) {
            try {
                String text = Files.readString(document, StandardCharsets.UTF_8);
                ChunkedCourse chunked = chunker.chunk(text);
                if (indexStore.upsert(chunked.course(), chunked.chunks())) {
                    added++;
                    chunks += chunked.chunks().size();
                } else {
                    skipped++;
                    log.info("Course '{}' from {} already indexed with {} chunks",
                            chunked.course().title(), document.getFileName(), indexStore.chunkCount(chunked.course().title()));
                }
            } catch (IOException | CourseRagException e) {
                failed++;
                log.warn("Skipping {}: {}", document.getFileName(), e.getMessage());
            }
        }
        return new IngestionReport(added, skipped, failed, chunks);
    }
}
