package eu.virtualparadox.techrag.rag.index;

import eu.virtualparadox.techrag.ingest.model.Chunk;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.*;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.*;
import org.apache.lucene.util.BytesRef;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static eu.virtualparadox.techrag.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Chunk text, citation metadata and dense vectors live in a single Lucene index:
 * <ul>
 *   <li>Each chunk is stored as one Lucene {@link Document}</li>
 *   <li>Text content and metadata are stored for answer synthesis and citations</li>
 *   <li>Vectors are written via {@link KnnFloatVectorField} to enable fast ANN search, and once more
 *       as a stored binary field so callers can re-rank with the exact vectors</li>
 * </ul>
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code sourceKey}: {@link StringField}, {@code <sourceType>:<source>}, used for replacement</li>
 *   <li>{@code source}, {@code sourceType}: {@link StringField#TYPE_STORED}</li>
 *   <li>{@code chunkIndex}, {@code domainRelevant}: {@link StoredField} ints</li>
 *   <li>{@code title}: {@link StoredField}, omitted when the chunk has none</li>
 *   <li>{@code content}: {@link TextField}, stored</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField} (HNSW indexed, euclidean; embeddings are
 *       unit length so the ranking equals cosine ranking)</li>
 *   <li>{@code vectorBytes}: {@link StoredField}, little-endian float32</li>
 * </ul>
 *
 * <p><b>Embedding model:</b> every commit records the embedding model id in the commit user data,
 * which {@link eu.virtualparadox.techrag.application.config.LuceneConfig} checks when the index opens.</p>
 */
@Service
@Slf4j
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final String embeddingModelId;

    /**
     * Lucene enforces a single dimension per vector field name across the entire index.
     * We cache the first-seen dimension and validate subsequent inserts.
     */
    private Integer vectorDim;

    public LuceneVectorIndexService(final IndexWriter writer,
                                    final SearcherManager searcherManager,
                                    @Value("${techrag.embedding.model:all-MiniLM-L6-v2}") final String embeddingModelId) {
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.embeddingModelId = embeddingModelId;
    }

    @Override
    public synchronized void add(final List<Chunk> chunks, final List<float[]> vectors) {
        requireNonEmpty(chunks, "chunks");
        requireNonEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        try {
            // 1) drop earlier chunks of every source in this batch
            final Set<String> sourceKeys = new LinkedHashSet<>();
            for (final Chunk c : chunks) {
                sourceKeys.add(sourceKey(c));
            }
            for (final String key : sourceKeys) {
                writer.deleteDocuments(new Term(FIELD_SOURCE_KEY, key));
            }

            // 2) add new chunks
            for (int i = 0; i < chunks.size(); i++) {
                writer.addDocument(buildLuceneDocument(chunks.get(i), vectors.get(i)));
            }

            // 3) commit and refresh for NRT visibility
            commit();
        }
        catch (IOException e) {
            throw new IndexUnavailableException("Failed to add " + chunks.size() + " chunks to the index", e);
        }
    }

    @Override
    public List<SearchResult> similaritySearch(final float[] vector, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                if (searcher.getIndexReader().numDocs() == 0) {
                    return List.of();
                }

                final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, vector, k), k);
                final StoredFields storedFields = searcher.storedFields();

                final List<SearchResult> results = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(sd.doc);
                    results.add(new SearchResult(toChunk(doc), toVector(doc.getBinaryValue(FIELD_VECTOR_BYTES)), sd.score));
                }
                return results;
            }
            finally {
                searcherManager.release(searcher);
            }
        }
        catch (IOException e) {
            throw new IndexUnavailableException("Similarity search failed", e);
        }
    }

    @Override
    public long count() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            }
            finally {
                searcherManager.release(searcher);
            }
        }
        catch (IOException e) {
            throw new IndexUnavailableException("Unable to read the index", e);
        }
    }

    @Override
    public List<Chunk> allChunks() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final int total = searcher.getIndexReader().numDocs();
                if (total == 0) {
                    return List.of();
                }

                final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), total);
                final StoredFields storedFields = searcher.storedFields();

                final List<Chunk> chunks = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    chunks.add(toChunk(storedFields.document(sd.doc)));
                }
                return chunks;
            }
            finally {
                searcherManager.release(searcher);
            }
        }
        catch (IOException e) {
            throw new IndexUnavailableException("Unable to read the index", e);
        }
    }

    @Override
    public synchronized void deleteAll() {
        try {
            writer.deleteAll();
            vectorDim = null;
            commit();
            log.info("Deleted all chunks from the index");
        }
        catch (IOException e) {
            throw new IndexUnavailableException("Failed to clear the index", e);
        }
    }

    private void commit() throws IOException {
        writer.setLiveCommitData(Map.of(COMMIT_EMBEDDING_MODEL, embeddingModelId).entrySet());
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws IllegalArgumentException if a different dimension has already been established
     */
    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final Chunk c, final float[] vec) {
        final Document d = new Document();

        // Identity and citation metadata
        d.add(new StringField(FIELD_SOURCE_KEY, sourceKey(c), Field.Store.NO));
        d.add(new StringField(FIELD_SOURCE, c.source(), Field.Store.YES));
        d.add(new StringField(FIELD_SOURCE_TYPE, c.sourceType().wireName(), Field.Store.YES));
        d.add(new StoredField(FIELD_CHUNK_INDEX, c.chunkIndex()));
        d.add(new StoredField(FIELD_DOMAIN_RELEVANT, c.domainRelevant() ? 1 : 0));
        if (c.title() != null) {
            d.add(new StoredField(FIELD_TITLE, c.title()));
        }

        // Text content (indexed + stored for retrieval)
        d.add(new TextField(FIELD_CONTENT, c.content(), Field.Store.YES));

        // Vector for HNSW ANN search, and a stored copy for exact re-ranking
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec));
        d.add(new StoredField(FIELD_VECTOR_BYTES, toBytes(vec)));

        return d;
    }

    private static Chunk toChunk(final Document doc) {
        return new Chunk(
                doc.get(FIELD_CONTENT),
                doc.get(FIELD_SOURCE),
                ESourceType.fromWireName(doc.get(FIELD_SOURCE_TYPE)),
                doc.getField(FIELD_CHUNK_INDEX).numericValue().intValue(),
                doc.get(FIELD_TITLE),
                doc.getField(FIELD_DOMAIN_RELEVANT).numericValue().intValue() == 1);
    }

    private static String sourceKey(final Chunk c) {
        return c.sourceType().wireName() + ":" + c.source();
    }

    private static byte[] toBytes(final float[] vec) {
        final ByteBuffer buffer = ByteBuffer.allocate(vec.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vec);
        return buffer.array();
    }

    private static float[] toVector(final BytesRef bytes) {
        final float[] vec = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asFloatBuffer()
                .get(vec);
        return vec;
    }

    private void requireNonEmpty(final List<?> value, final String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
