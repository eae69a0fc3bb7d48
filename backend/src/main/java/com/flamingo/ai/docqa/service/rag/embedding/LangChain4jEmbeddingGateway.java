package com.flamingo.ai.docqa.service.rag.embedding;

import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Embeds text through a LangChain4j {@link EmbeddingModel}, e.g. OpenAI. */
@Slf4j
public class LangChain4jEmbeddingGateway extends AbstractEmbeddingGateway {

  // text-embedding-3-small accepts 8192 tokens; stay well below it for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  public LangChain4jEmbeddingGateway(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, int dimensions, int batchSize) {
    super(dimensions, batchSize);
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "embedding.embed", description = "Time to embed a list of texts")
  public List<float[]> embed(List<String> texts) {
    return super.embed(texts);
  }

  @Override
  protected List<float[]> embedBatch(List<String> batch) {
    List<TextSegment> segments = new ArrayList<>(batch.size());
    for (String text : batch) {
      segments.add(TextSegment.from(truncate(text)));
    }

    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      log.warn("Embedding call for {} texts failed: {}", batch.size(), e.getMessage());
      throw new ModelUnavailableException("Embedding model unavailable: " + e.getMessage(), e);
    }
    meterRegistry.counter("embedding.requests.success").increment();

    List<float[]> vectors = new ArrayList<>(response.content().size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    return vectors;
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }
}
