package com.flamingo.ai.docqa.service.rag.embedding;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic bag-of-words embeddings using the hashing trick. Texts sharing words get similar
 * vectors, which is enough for local development and tests without a model service.
 */
@Slf4j
public class HashingEmbeddingGateway extends AbstractEmbeddingGateway {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
  private static final HashFunction BUCKET_HASH = Hashing.murmur3_32_fixed(17);
  private static final HashFunction SIGN_HASH = Hashing.murmur3_32_fixed(31);

  public HashingEmbeddingGateway(int dimensions, int batchSize) {
    super(dimensions, batchSize);
    log.info("Using hashing embeddings with {} dimensions", dimensions);
  }

  @Override
  protected List<float[]> embedBatch(List<String> batch) {
    List<float[]> vectors = new ArrayList<>(batch.size());
    for (String text : batch) {
      vectors.add(embedText(text));
    }
    return vectors;
  }

  private float[] embedText(String text) {
    float[] vector = new float[dimensions()];
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      int bucket =
          Math.floorMod(BUCKET_HASH.hashString(token, StandardCharsets.UTF_8).asInt(), dimensions());
      float sign = (SIGN_HASH.hashString(token, StandardCharsets.UTF_8).asInt() & 1) == 0 ? 1f : -1f;
      vector[bucket] += sign;
    }

    double norm = 0;
    for (float v : vector) {
      norm += v * v;
    }
    if (norm > 0) {
      float scale = (float) (1.0 / Math.sqrt(norm));
      for (int i = 0; i < vector.length; i++) {
        vector[i] *= scale;
      }
    }
    return vector;
  }
}
