package eu.virtualparadox.techrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import eu.virtualparadox.techrag.application.config.ApplicationConfig;
import eu.virtualparadox.techrag.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import ai.onnxruntime.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embedder running a transformer exported to ONNX (all-MiniLM-L6-v2 by default).
 * <p>
 * The model is expected under {@code <techrag.models>/<model id>/} as {@code model.onnx} plus
 * {@code tokenizer.json}. Token vectors are mean-pooled over the attention mask and L2-normalized.
 */
@Service
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private static final int MAX_LEN = 256;
    private static final int BATCH_SIZE = 16;

    private final String modelId;
    private final int intraOpThreads;
    private final int interOpThreads;
    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config,
                                @Value("${techrag.embedding.model:all-MiniLM-L6-v2}") final String modelId,
                                @Value("${techrag.embedding.intra-op-threads:0}") final int intraOpThreads,
                                @Value("${techrag.embedding.inter-op-threads:1}") final int interOpThreads) {
        this.modelId = modelId;
        this.intraOpThreads = intraOpThreads;
        this.interOpThreads = interOpThreads;

        final Path modelRoot = config.getModels().resolve(modelId);
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        try (OrtSession.SessionOptions options = OrtInitializer.sessionOptions(intraOpThreads, interOpThreads)) {
            this.session = env.createSession(modelPath.toString(), options);
        }
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        logger.info("Loaded ONNX embedding model: {}", modelPath);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            final int to = Math.min(texts.size(), from + BATCH_SIZE);
            result.addAll(embedBatch(texts.subList(from, to)));
        }
        logger.debug("Embedded {} texts", texts.size());
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > MAX_LEN) {
                maxLen = MAX_LEN;
            }

            final int batchSize = encodings.size();
            final long[][] inputIdArr = new long[batchSize][maxLen];
            final long[][] attnMaskArr = new long[batchSize][maxLen];
            final long[][] tokenTypeArr = new long[batchSize][maxLen];

            for (int i = 0; i < batchSize; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(batchSize);
                    for (int i = 0; i < batchSize; i++) {
                        final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                        normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final Exception e) {
            throw new IllegalStateException("Failed to embed batch", e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
