package eu.virtualparadox.techrag.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.IOUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static eu.virtualparadox.techrag.util.LuceneConstants.COMMIT_EMBEDDING_MODEL;

/**
 * Opens the on-disk chunk index under {@code techrag.index} and closes it on shutdown.
 * <p>
 * The writer is checked against the embedding model recorded in the last commit: vectors of
 * different models are not comparable, so a mismatch is reported as soon as the index opens.
 * </p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private Analyzer analyzer;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        return this.directory;
    }

    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    /**
     * @param ramBufferMb      buffered documents are flushed to a new segment beyond this size
     * @param embeddingModelId model the application embeds with
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir,
                                   final Analyzer analyzer,
                                   @Value("${techrag.index.ram-buffer-mb:64}") final double ramBufferMb,
                                   @Value("${techrag.embedding.model:all-MiniLM-L6-v2}") final String embeddingModelId)
            throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setRAMBufferSizeMB(ramBufferMb)
                .setCommitOnClose(true);
        this.indexWriter = new IndexWriter(dir, cfg);

        final String recorded = recordedEmbeddingModel(indexWriter);
        log.info("Opened chunk index at {} with {} chunks, embedding model {}",
                dir, indexWriter.getDocStats().numDocs, recorded == null ? "not recorded yet" : recorded);
        if (recorded != null && !recorded.equals(embeddingModelId)) {
            log.error("Index was built with embedding model '{}' but '{}' is configured; "
                    + "clear the collection and ingest again before querying", recorded, embeddingModelId);
        }
        return this.indexWriter;
    }

    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    /**
     * @return the embedding model id stored with the last commit, or {@code null} for a fresh index
     */
    public static String recordedEmbeddingModel(final IndexWriter writer) {
        final Iterable<Map.Entry<String, String>> data = writer.getLiveCommitData();
        if (data == null) {
            return null;
        }
        for (final Map.Entry<String, String> entry : data) {
            if (COMMIT_EMBEDDING_MODEL.equals(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Closes searcher, writer, analyzer and directory in that order; every one is attempted.
     */
    @PreDestroy
    public void close() {
        try {
            IOUtils.close(searcherManager, indexWriter, analyzer, directory);
            log.info("Closed chunk index");
        }
        catch (IOException e) {
            log.error("Unable to close the chunk index cleanly", e);
        }
    }
}
