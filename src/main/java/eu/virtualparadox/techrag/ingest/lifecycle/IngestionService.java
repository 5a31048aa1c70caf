package eu.virtualparadox.techrag.ingest.lifecycle;

import eu.virtualparadox.techrag.application.config.ApplicationConfig;
import eu.virtualparadox.techrag.ingest.chunker.Chunker;
import eu.virtualparadox.techrag.ingest.extractor.ExtractionException;
import eu.virtualparadox.techrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.techrag.ingest.extractor.WebPageExtractor;
import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.rag.embed.EmbeddingService;
import eu.virtualparadox.techrag.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs inputs through the ingestion pipeline:
 * <ol>
 *   <li>Extract text (PDF with OCR fallback, image OCR, or web page)</li>
 *   <li>Chunk and tag each chunk for domain relevance</li>
 *   <li>Embed the chunks and add them to the vector index</li>
 * </ol>
 * <p>
 * Every file or URL is an independent item: a failure is logged, counted in the returned
 * {@link IngestionReport} and does not stop the rest of a batch. Relevance tags never drop content;
 * a document without any relevant chunk is indexed in full with a warning.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final List<TextExtractor> textExtractors;
    private final WebPageExtractor webPageExtractor;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final ApplicationConfig config;

    public boolean supports(final Path path) {
        return extractorFor(path).isPresent();
    }

    public IngestionReport ingestFile(final Path path) {
        final Optional<TextExtractor> extractor = extractorFor(path);
        if (extractor.isEmpty()) {
            log.warn("Unsupported file type: {}", path);
            return IngestionReport.failure("Unsupported file type: " + path.getFileName());
        }

        try {
            log.info("Processing file {}", path);
            return IngestionReport.success(index(extractor.get().extract(path)));
        }
        catch (RuntimeException e) {
            log.error("Failed to ingest {}", path, e);
            return IngestionReport.failure(path.getFileName() + ": " + e.getMessage());
        }
    }

    public IngestionReport ingestUrl(final String url) {
        try {
            log.info("Processing URL {}", url);
            return IngestionReport.success(index(webPageExtractor.extract(url)));
        }
        catch (RuntimeException e) {
            log.error("Failed to ingest {}", url, e);
            return IngestionReport.failure(url + ": " + e.getMessage());
        }
    }

    /**
     * Ingests every supported file below {@code directory}, in path order.
     *
     * @throws IllegalArgumentException if {@code directory} is not a directory
     * @throws ExtractionException      if the directory cannot be listed
     */
    public IngestionReport ingestDirectory(final Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }

        final List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(this::supports)
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw new ExtractionException("Unable to list directory " + directory, e);
        }

        log.info("Found {} supported files in {}", files.size(), directory);
        IngestionReport report = IngestionReport.empty();
        for (final Path file : files) {
            report = report.plus(ingestFile(file));
        }
        log.info("Directory {} done: {} succeeded, {} failed, {} chunks indexed",
                directory, report.itemsSucceeded(), report.itemsFailed(), report.chunksIndexed());
        return report;
    }

    /**
     * Stages an uploaded file under the uploads folder and ingests it.
     */
    public IngestionReport ingestUpload(final String fileName, final InputStream content) throws IOException {
        final Path name = Path.of(fileName).getFileName();
        if (name == null || !supports(name)) {
            return IngestionReport.failure("Unsupported file type: " + fileName);
        }

        Files.createDirectories(config.getUploads());
        final Path staged = config.getUploads().resolve(name.toString());
        Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
        log.info("Staged upload {} at {}", fileName, staged);

        return ingestFile(staged);
    }

    private Optional<TextExtractor> extractorFor(final Path path) {
        return textExtractors.stream()
                .filter(e -> e.supports(path))
                .findFirst();
    }

    /**
     * @return number of chunks written
     */
    private int index(final ExtractedDocument document) {
        final List<Chunk> chunks = chunker.chunk(document);
        if (chunks.isEmpty()) {
            log.warn("No text extracted from {}", document.source());
            return 0;
        }

        final long relevant = chunks.stream().filter(Chunk::domainRelevant).count();
        if (relevant == 0) {
            log.warn("No domain relevant content found in {}, indexing all {} chunks anyway",
                    document.source(), chunks.size());
        }

        final List<float[]> vectors = embeddingService.embed(chunks.stream().map(Chunk::content).toList());
        vectorIndexService.add(chunks, vectors);

        log.info("Added {} chunks ({} domain relevant) from {}", chunks.size(), relevant, document.source());
        return chunks.size();
    }
}
