package eu.virtualparadox.articlefinder.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.articlefinder.application.config.ApplicationConfig;
import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embedding with an ONNX export of a BERT-style encoder (mean pooling + L2 normalization).
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under {@code <models>/retriever}. If they are missing or
 * fail to load the service stays up but reports {@link CapabilityUnavailableException} on every call, so retrieval
 * degrades to lexical-only ranking instead of refusing to start.
 */
@Slf4j
@Service
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_LEN = 512;
    private static final int BATCH_SIZE = 16;

    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        final Path retrieverModelRoot = config.getModels().resolve("retriever");
        this.modelPath = retrieverModelRoot.resolve("model.onnx");
        this.tokenizerPath = retrieverModelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() {
        if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            log.warn("Embedding model not found at {}, semantic search is disabled", modelPath.getParent());
            return;
        }
        try {
            this.env = OrtEnvironment.getEnvironment();
            this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt());
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

            log.info("Loaded ONNX embedding model: {}", modelPath);
            log.info("Model expects inputs: {}", session.getInputNames());
        } catch (final OrtException | IOException | RuntimeException e) {
            log.warn("Unable to load embedding model {}, semantic search is disabled", modelPath, e);
            this.session = null;
            this.tokenizer = null;
        }
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public List<float[]> embed(final List<Chunk> chunks) {
        final List<String> texts = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            texts.add(chunk.normText());
        }

        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            result.addAll(embedBatch(texts.subList(from, Math.min(from + BATCH_SIZE, texts.size()))));
        }
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    private List<float[]> embedBatch(final List<String> texts) {
        if (session == null || tokenizer == null) {
            throw new CapabilityUnavailableException("Embedding model is not loaded");
        }
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String t : texts) {
                final Encoding e = tokenizer.encode(t);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            maxLen = Math.max(1, Math.min(maxLen, MAX_LEN));

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
        } catch (final OrtException | RuntimeException e) {
            throw new CapabilityUnavailableException("Failed to embed batch of " + texts.size(), e);
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
