package eu.virtualparadox.techrag.web;

import eu.virtualparadox.techrag.ingest.lifecycle.IngestionReport;
import eu.virtualparadox.techrag.ingest.lifecycle.IngestionService;
import eu.virtualparadox.techrag.query.QueryManager;
import eu.virtualparadox.techrag.query.model.CollectionStats;
import eu.virtualparadox.techrag.query.model.HealthStatus;
import eu.virtualparadox.techrag.query.model.QueryResult;
import eu.virtualparadox.techrag.web.dto.MessageResponse;
import eu.virtualparadox.techrag.web.dto.PathRequest;
import eu.virtualparadox.techrag.web.dto.QueryRequest;
import eu.virtualparadox.techrag.web.dto.SimilarResponse;
import eu.virtualparadox.techrag.web.dto.UrlRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class KnowledgeController {

    private final QueryManager queryManager;
    private final IngestionService ingestionService;

    @PostMapping("/query")
    public QueryResult query(@Valid @RequestBody final QueryRequest request) {
        return queryManager.query(request.question());
    }

    @PostMapping(value = "/documents/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionReport> upload(@RequestParam("file") final MultipartFile file) throws IOException {
        if (file.isEmpty() || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
            throw new IllegalArgumentException("An uploaded file with a name is required");
        }
        try (InputStream content = file.getInputStream()) {
            return ResponseEntity.ok(ingestionService.ingestUpload(file.getOriginalFilename(), content));
        }
    }

    @PostMapping("/documents/url")
    public IngestionReport ingestUrl(@Valid @RequestBody final UrlRequest request) {
        return ingestionService.ingestUrl(request.url());
    }

    /**
     * Ingests a file or, recursively, every supported file of a directory on the server.
     */
    @PostMapping("/documents/path")
    public IngestionReport ingestPath(@Valid @RequestBody final PathRequest request) {
        final Path path = Path.of(request.path());
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Path does not exist: " + request.path());
        }
        return Files.isDirectory(path) ? ingestionService.ingestDirectory(path) : ingestionService.ingestFile(path);
    }

    /**
     * Nearest chunks for a query, without answer generation.
     */
    @GetMapping("/similar")
    public SimilarResponse similar(@RequestParam("query") final String query,
                                   @RequestParam(value = "limit", defaultValue = "5") final int limit) {
        if (query.isBlank() || limit < 1) {
            throw new IllegalArgumentException("query must not be blank and limit must be positive");
        }
        return new SimilarResponse(query, queryManager.similar(query, limit));
    }

    @GetMapping("/stats")
    public CollectionStats stats() {
        return queryManager.stats();
    }

    @GetMapping("/health")
    public HealthStatus health() {
        return queryManager.health();
    }

    @DeleteMapping("/documents")
    public MessageResponse clear() {
        queryManager.clear();
        return new MessageResponse("Document collection deleted");
    }

    @PostMapping("/backend/reset")
    public MessageResponse resetBackend() {
        queryManager.resetBackend();
        return new MessageResponse("Backend routing reset to primary");
    }
}
