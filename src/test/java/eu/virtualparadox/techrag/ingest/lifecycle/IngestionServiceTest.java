package eu.virtualparadox.techrag.ingest.lifecycle;

import eu.virtualparadox.techrag.application.config.ApplicationConfig;
import eu.virtualparadox.techrag.ingest.chunker.Chunker;
import eu.virtualparadox.techrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.techrag.ingest.enrich.TechnicalValueExtractor;
import eu.virtualparadox.techrag.ingest.extractor.ImageTextExtractor;
import eu.virtualparadox.techrag.ingest.extractor.ExtractionException;
import eu.virtualparadox.techrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.techrag.ingest.extractor.WebPageExtractor;
import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.ingest.ocr.ImageEnhancer;
import eu.virtualparadox.techrag.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.techrag.testsupport.HashingEmbeddingService;
import eu.virtualparadox.techrag.testsupport.LuceneTestIndex;
import eu.virtualparadox.techrag.testsupport.TestVocabulary;
import eu.virtualparadox.techrag.testsupport.UnlinkedTesseractOcrEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionServiceTest {

    /**
     * Reads {@code .txt} files verbatim; files containing {@code CORRUPT} fail like a broken PDF.
     */
    private static final class PlainTextExtractor implements TextExtractor {

        @Override
        public boolean supports(final Path path) {
            return path.getFileName().toString().endsWith(".txt");
        }

        @Override
        public ExtractedDocument extract(final Path path) {
            try {
                final String text = Files.readString(path);
                if (text.contains("CORRUPT")) {
                    throw new ExtractionException("Unreadable file " + path);
                }
                return new ExtractedDocument(path.toString(), ESourceType.PDF, path.getFileName().toString(), text);
            }
            catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    /**
     * Serves fixed HTML instead of touching the network.
     */
    private static final class CannedWebPageExtractor extends WebPageExtractor {

        CannedWebPageExtractor() {
            super(new TextCleaner(), 1000, 1, 10);
        }

        @Override
        public ExtractedDocument extract(final String url) {
            if (url.contains("missing")) {
                throw new ExtractionException("Failed to fetch " + url);
            }
            return new ExtractedDocument(url, ESourceType.WEB, "Loop antennas",
                    "Small transmitting loop antennas need a high voltage tuning capacitor.");
        }
    }

    @TempDir
    Path tempDir;

    private LuceneTestIndex index;
    private LuceneVectorIndexService vectorIndex;
    private ApplicationConfig config;
    private IngestionService service;

    @BeforeEach
    void setUp() throws IOException {
        index = new LuceneTestIndex();
        vectorIndex = index.service("hashing-test");

        config = new ApplicationConfig();
        config.setUploads(tempDir.resolve("uploads"));

        service = new IngestionService(
                List.of(new PlainTextExtractor()),
                new CannedWebPageExtractor(),
                new Chunker(200, 40, TestVocabulary.relevanceFilter()),
                new HashingEmbeddingService(),
                vectorIndex,
                config);
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    private Path write(final String relative, final String text) throws IOException {
        final Path file = tempDir.resolve("docs").resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
        return file;
    }

    @Test
    @DisplayName("One broken file in a directory does not stop the others")
    void directoryWithPartialFailure() throws IOException {
        write("a.txt", "The SWR meter reads 1.5 on the 20 m band.");
        write("nested/b.txt", "CORRUPT");
        write("c.txt", "Antenna design notes for a 40 m dipole.");
        write("ignored.md", "not a supported type");

        final IngestionReport report = service.ingestDirectory(tempDir.resolve("docs"));

        assertThat(report.itemsSucceeded()).isEqualTo(2);
        assertThat(report.itemsFailed()).isEqualTo(1);
        assertThat(report.chunksIndexed()).isEqualTo(2);
        assertThat(report.failures()).singleElement().asString().contains("b.txt");
        assertThat(vectorIndex.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Content without domain terms is still indexed, tagged as not relevant")
    void irrelevantContentIsKept() throws IOException {
        final Path file = write("cake.txt", "Whisk the eggs and sugar until fluffy, then fold in the flour.");

        final IngestionReport report = service.ingestFile(file);

        assertThat(report.chunksIndexed()).isEqualTo(1);
        assertThat(vectorIndex.allChunks()).singleElement()
                .satisfies(c -> assertThat(c.domainRelevant()).isFalse());
    }

    @Test
    @DisplayName("Ingesting a file again replaces its chunks instead of duplicating them")
    void reingestReplaces() throws IOException {
        final Path file = write("manual.txt", "First revision of the antenna design manual.");
        service.ingestFile(file);

        Files.writeString(file, "Second revision of the antenna design manual.");
        service.ingestFile(file);

        assertThat(vectorIndex.allChunks()).extracting(Chunk::content)
                .containsExactly("Second revision of the antenna design manual.");
    }

    @Test
    @DisplayName("A file that yields no text succeeds with zero chunks")
    void blankFile() throws IOException {
        final IngestionReport report = service.ingestFile(write("blank.txt", "  \n\n "));

        assertThat(report).isEqualTo(new IngestionReport(1, 0, 0, List.of()));
        assertThat(vectorIndex.count()).isZero();
    }

    @Test
    void unsupportedFileIsAFailure() throws IOException {
        final IngestionReport report = service.ingestFile(write("notes.docx", "x"));

        assertThat(report.itemsFailed()).isEqualTo(1);
        assertThat(service.supports(Path.of("notes.docx"))).isFalse();
        assertThat(service.supports(Path.of("notes.txt"))).isTrue();
    }

    @Test
    void urlIngestion() {
        final IngestionReport ok = service.ingestUrl("https://example.org/loops");
        final IngestionReport failed = service.ingestUrl("https://example.org/missing");

        assertThat(ok.chunksIndexed()).isEqualTo(1);
        assertThat(failed.itemsFailed()).isEqualTo(1);
        assertThat(failed.failures()).singleElement().asString().startsWith("https://example.org/missing");
        assertThat(vectorIndex.allChunks()).singleElement()
                .satisfies(c -> {
                    assertThat(c.sourceType()).isEqualTo(ESourceType.WEB);
                    assertThat(c.title()).isEqualTo("Loop antennas");
                });
    }

    @Test
    @DisplayName("Uploads are staged under the uploads folder before ingestion")
    void uploadIsStaged() throws IOException {
        final byte[] content = "QRP transceiver alignment steps.".getBytes(StandardCharsets.UTF_8);

        final IngestionReport report = service.ingestUpload("../../evil/qrp.txt", new ByteArrayInputStream(content));

        assertThat(report.itemsSucceeded()).isEqualTo(1);
        assertThat(tempDir.resolve("uploads").resolve("qrp.txt")).exists();
        assertThat(vectorIndex.allChunks()).singleElement()
                .satisfies(c -> assertThat(c.source()).endsWith("qrp.txt"));
    }

    @Test
    void uploadOfUnsupportedTypeIsRejected() throws IOException {
        final IngestionReport report = service.ingestUpload("virus.exe", new ByteArrayInputStream(new byte[0]));

        assertThat(report.itemsFailed()).isEqualTo(1);
        assertThat(tempDir.resolve("uploads")).doesNotExist();
    }

    @Test
    void directoryMustExist() {
        assertThatThrownBy(() -> service.ingestDirectory(tempDir.resolve("nope")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Images fail one by one when the OCR native library is missing")
    void missingOcrLibrary_failsEachImageWithoutAbortingTheBatch() throws IOException {
        final Path docs = tempDir.resolve("scans");
        Files.createDirectories(docs);
        ImageIO.write(new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB), "png", docs.resolve("a.png").toFile());
        ImageIO.write(new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB), "png", docs.resolve("b.png").toFile());

        final ImageTextExtractor images = new ImageTextExtractor(new TextCleaner(), new ImageEnhancer(11, 2),
                new UnlinkedTesseractOcrEngine(), new TechnicalValueExtractor());
        final IngestionService withImages = new IngestionService(
                List.of(images),
                new CannedWebPageExtractor(),
                new Chunker(200, 40, TestVocabulary.relevanceFilter()),
                new HashingEmbeddingService(),
                vectorIndex,
                config);

        final IngestionReport report = withImages.ingestDirectory(docs);

        assertThat(report.itemsSucceeded()).isZero();
        assertThat(report.itemsFailed()).isEqualTo(2);
        assertThat(report.failures()).hasSize(2)
                .allSatisfy(f -> assertThat(f).contains("native library"));
        assertThat(vectorIndex.count()).isZero();
    }
}
