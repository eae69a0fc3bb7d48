package com.flamingo.ai.docqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import com.flamingo.ai.docqa.exception.VectorIndexException;
import com.flamingo.ai.docqa.service.rag.index.IndexLock;
import com.flamingo.ai.docqa.service.rag.index.SimilarityMetric;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.service.rag.index.VectorMatch;
import com.flamingo.ai.docqa.service.rag.index.VectorMetadata;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Vector index backed by an Elasticsearch {@code dense_vector} field.
 *
 * <p>The index is created with automatic refresh disabled, so writes only become searchable on an
 * explicit refresh. Writes outside an exclusive section refresh immediately; writes inside one are
 * refreshed together when the section closes.
 */
@Slf4j
public class ElasticsearchVectorIndex implements VectorIndex {

  private static final String DOCUMENT_ID = "documentId";
  private static final String SEQUENCE_INDEX = "sequenceIndex";
  private static final String REVISION = "revision";
  private static final String EMBEDDING = "embedding";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int dimensions;
  private final SimilarityMetric metric;
  private final Map<UUID, ReentrantLock> sections = new ConcurrentHashMap<>();

  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int dimensions,
      SimilarityMetric metric) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.dimensions = dimensions;
    this.metric = metric;
  }

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (exists) {
        verifyDimensions();
        return;
      }
      Map<String, Property> properties = new HashMap<>();
      properties.put(DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
      properties.put(SEQUENCE_INDEX, Property.of(p -> p.integer(i -> i)));
      properties.put(REVISION, Property.of(p -> p.integer(i -> i)));
      properties.put(
          EMBEDDING,
          Property.of(
              p ->
                  p.denseVector(
                      DenseVectorProperty.of(
                          d -> d.dims(dimensions).index(true).similarity(similarity())))));
      elasticsearchClient
          .indices()
          .create(
              c ->
                  c.index(indexName)
                      .settings(s -> s.refreshInterval(t -> t.time("-1")))
                      .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
      log.info("Created Elasticsearch index: {} (dims={}, metric={})", indexName, dimensions, metric);
    } catch (IOException | ElasticsearchException e) {
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  private void verifyDimensions() throws IOException {
    var mapping = elasticsearchClient.indices().getMapping(g -> g.index(indexName)).get(indexName);
    if (mapping == null) {
      return;
    }
    Property embedding = mapping.mappings().properties().get(EMBEDDING);
    if (embedding == null || !embedding.isDenseVector()) {
      throw new IllegalStateException(
          "Index '" + indexName + "' has no dense_vector field '" + EMBEDDING + "'");
    }
    Integer actual = embedding.denseVector().dims();
    if (actual != null && actual != dimensions) {
      throw new DimensionMismatchException(dimensions, actual);
    }
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public SimilarityMetric metric() {
    return metric;
  }

  @Override
  @Timed(value = "vector_index.insert", description = "Time to index one chunk vector")
  public void insert(String chunkId, float[] vector, VectorMetadata metadata) {
    checkDimensions(vector);
    Map<String, Object> document = new HashMap<>();
    document.put(DOCUMENT_ID, metadata.documentId().toString());
    document.put(SEQUENCE_INDEX, metadata.sequenceIndex());
    document.put(REVISION, metadata.revision());
    document.put(EMBEDDING, toList(vector));
    try {
      elasticsearchClient.index(i -> i.index(indexName).id(chunkId).document(document));
      meterRegistry.counter("vector_index.indexed").increment();
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to index chunk " + chunkId, e);
    }
    refreshUnlessInSection(metadata.documentId());
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for vector search")
  public List<VectorMatch> search(float[] query, int k, double scoreThreshold) {
    checkDimensions(query);
    if (k <= 0) {
      return List.of();
    }
    // Over-fetch so that ties at the cut-off are resolved by chunk id rather than by shard order.
    int fetch = k * 2;
    try {
      SearchResponse<ObjectNode> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .size(fetch)
                      .source(src -> src.filter(f -> f.includes(DOCUMENT_ID, REVISION)))
                      .knn(
                          kn ->
                              kn.field(EMBEDDING)
                                  .queryVector(toList(query))
                                  .k(fetch)
                                  .numCandidates(Math.max(fetch * 2, 50))),
              ObjectNode.class);

      List<VectorMatch> matches = new ArrayList<>();
      for (Hit<ObjectNode> hit : response.hits().hits()) {
        if (hit.score() == null || hit.source() == null) {
          continue;
        }
        double score = fromElasticsearchScore(hit.score());
        if (score >= scoreThreshold) {
          ObjectNode source = hit.source();
          UUID documentId = UUID.fromString(source.path(DOCUMENT_ID).asText());
          matches.add(
              new VectorMatch(hit.id(), documentId, source.path(REVISION).asInt(), score));
        }
      }
      matches.sort(VectorMatch.RANKING);
      meterRegistry.counter("vector_index.search").increment();
      return matches.size() > k ? List.copyOf(matches.subList(0, k)) : matches;
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Vector search failed", e);
    }
  }

  @Override
  public void delete(UUID documentId) {
    try {
      elasticsearchClient.deleteByQuery(d -> d.index(indexName).query(byDocument(documentId)));
      log.debug("Deleted vectors of document {} from {}", documentId, indexName);
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to delete vectors of document " + documentId, e);
    }
    refreshUnlessInSection(documentId);
  }

  @Override
  public long count(UUID documentId) {
    try {
      return elasticsearchClient.count(c -> c.index(indexName).query(byDocument(documentId))).count();
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to count vectors of document " + documentId, e);
    }
  }

  /**
   * Serializes writers of the same document within this process and defers the refresh until the
   * section closes. Other processes writing to the same index are not coordinated.
   */
  @Override
  public IndexLock exclusive(UUID documentId) {
    ReentrantLock lock = sections.computeIfAbsent(documentId, id -> new ReentrantLock());
    lock.lock();
    return () -> {
      try {
        if (lock.getHoldCount() == 1) {
          refresh();
        }
      } finally {
        lock.unlock();
      }
    };
  }

  private void refreshUnlessInSection(UUID documentId) {
    ReentrantLock lock = sections.get(documentId);
    if (lock == null || !lock.isHeldByCurrentThread()) {
      refresh();
    }
  }

  private void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to refresh index " + indexName, e);
    }
  }

  private static Query byDocument(UUID documentId) {
    return Query.of(q -> q.term(t -> t.field(DOCUMENT_ID).value(documentId.toString())));
  }

  private DenseVectorSimilarity similarity() {
    return metric == SimilarityMetric.COSINE
        ? DenseVectorSimilarity.Cosine
        : DenseVectorSimilarity.L2Norm;
  }

  /** Maps Elasticsearch's non-negative knn score back onto the metric's own scale. */
  double fromElasticsearchScore(double score) {
    if (metric == SimilarityMetric.COSINE) {
      return 2 * score - 1;
    }
    // l2_norm scores are 1 / (1 + d^2)
    double distance = Math.sqrt(Math.max(0, 1 / score - 1));
    return 1 / (1 + distance);
  }

  private void checkDimensions(float[] vector) {
    if (vector.length != dimensions) {
      throw new DimensionMismatchException(dimensions, vector.length);
    }
  }

  private static List<Float> toList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float v : vector) {
      values.add(v);
    }
    return values;
  }
}
