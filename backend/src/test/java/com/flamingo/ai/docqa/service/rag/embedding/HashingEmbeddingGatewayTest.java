package com.flamingo.ai.docqa.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.docqa.service.rag.index.SimilarityMetric;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HashingEmbeddingGateway Tests")
class HashingEmbeddingGatewayTest {

  private final HashingEmbeddingGateway gateway = new HashingEmbeddingGateway(64, 4);

  @Test
  @DisplayName("Should return one normalized vector per text")
  void shouldReturnOneNormalizedVectorPerText() {
    List<float[]> vectors = gateway.embed(List.of("one", "two words", "three little words", "4", "5"));

    assertThat(vectors).hasSize(5).allSatisfy(vector -> assertThat(vector).hasSize(64));
    double norm = 0;
    for (float v : vectors.get(2)) {
      norm += v * v;
    }
    assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
  }

  @Test
  @DisplayName("Should be deterministic and ignore case and punctuation")
  void shouldBeDeterministic() {
    float[] first = gateway.embedQuery("The Sky is BLUE!");
    float[] second = new HashingEmbeddingGateway(64, 1).embedQuery("the sky, is blue");

    assertThat(first).containsExactly(second);
  }

  @Test
  @DisplayName("Should score texts sharing words above unrelated texts")
  void shouldScoreSharedWordsHigher() {
    float[] query = gateway.embedQuery("what color is the sky");
    float[] related = gateway.embedQuery("the sky is blue");
    float[] unrelated = gateway.embedQuery("grass grows green");

    assertThat(SimilarityMetric.COSINE.score(query, related))
        .isGreaterThan(SimilarityMetric.COSINE.score(query, unrelated));
  }

  @Test
  @DisplayName("Should embed text without words as the zero vector")
  void shouldEmbedEmptyTextAsZeroVector() {
    assertThat(gateway.embedQuery("  ...  ")).containsOnly(0f);
  }
}
