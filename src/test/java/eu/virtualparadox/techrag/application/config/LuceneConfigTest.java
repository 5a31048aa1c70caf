package eu.virtualparadox.techrag.application.config;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static eu.virtualparadox.techrag.util.LuceneConstants.COMMIT_EMBEDDING_MODEL;
import static org.assertj.core.api.Assertions.assertThat;

class LuceneConfigTest {

    @TempDir
    Path tempDir;

    private ApplicationConfig applicationConfig() {
        final ApplicationConfig config = new ApplicationConfig();
        config.setIndex(tempDir.resolve("index"));
        return config;
    }

    private IndexWriter open(final LuceneConfig luceneConfig, final String modelId) throws IOException {
        final Directory directory = luceneConfig.luceneDirectory(applicationConfig());
        return luceneConfig.indexWriter(directory, luceneConfig.analyzer(), 32, modelId);
    }

    @Test
    @DisplayName("The index and its recorded embedding model survive a restart")
    void reopensExistingIndex() throws IOException {
        final LuceneConfig first = new LuceneConfig();
        final IndexWriter writer = open(first, "all-MiniLM-L6-v2");
        assertThat(LuceneConfig.recordedEmbeddingModel(writer)).isNull();

        final Document doc = new Document();
        doc.add(new StringField("source", "manual.pdf", Field.Store.YES));
        writer.addDocument(doc);
        writer.setLiveCommitData(Map.of(COMMIT_EMBEDDING_MODEL, "all-MiniLM-L6-v2").entrySet());
        writer.commit();
        first.close();

        final LuceneConfig second = new LuceneConfig();
        final IndexWriter reopened = open(second, "another-model");
        final SearcherManager searcherManager = second.searcherManager(reopened);
        try {
            assertThat(LuceneConfig.recordedEmbeddingModel(reopened)).isEqualTo("all-MiniLM-L6-v2");
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                assertThat(searcher.getIndexReader().numDocs()).isEqualTo(1);
            }
            finally {
                searcherManager.release(searcher);
            }
        }
        finally {
            second.close();
        }
    }

    @Test
    void writerUsesConfiguredRamBuffer() throws IOException {
        final LuceneConfig luceneConfig = new LuceneConfig();
        final IndexWriter writer = open(luceneConfig, "all-MiniLM-L6-v2");

        assertThat(writer.getConfig().getRAMBufferSizeMB()).isEqualTo(32.0);
        assertThat(writer.getConfig().getCommitOnClose()).isTrue();

        luceneConfig.close();
        assertThat(writer.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Closing before anything was opened is harmless")
    void closeWithoutResources() {
        new LuceneConfig().close();
    }
}
