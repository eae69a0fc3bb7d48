package com.flamingo.ai.docqa.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryVectorIndex Tests")
class InMemoryVectorIndexTest {

  private final UUID docA = UUID.randomUUID();
  private final UUID docB = UUID.randomUUID();

  private InMemoryVectorIndex index;

  @BeforeEach
  void setUp() {
    index = new InMemoryVectorIndex(3, SimilarityMetric.COSINE);
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("Should rank matches by descending score")
    void shouldRankMatchesByDescendingScore() {
      index.insert("a_0", new float[] {1, 0, 0}, new VectorMetadata(docA, 0, 1));
      index.insert("a_1", new float[] {0, 1, 0}, new VectorMetadata(docA, 1, 1));
      index.insert("b_0", new float[] {1, 1, 0}, new VectorMetadata(docB, 0, 1));

      List<VectorMatch> matches = index.search(new float[] {1, 0, 0}, 3, -1.0);

      assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("a_0", "b_0", "a_1");
      assertThat(matches.get(0).score()).isCloseTo(1.0, within(1e-6));
      assertThat(matches.get(1).documentId()).isEqualTo(docB);
    }

    @Test
    @DisplayName("Should break score ties by chunk id")
    void shouldBreakTiesByChunkId() {
      index.insert("b_0", new float[] {1, 0, 0}, new VectorMetadata(docB, 0, 1));
      index.insert("a_0", new float[] {2, 0, 0}, new VectorMetadata(docA, 0, 1));

      List<VectorMatch> matches = index.search(new float[] {1, 0, 0}, 2, 0.0);

      assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("a_0", "b_0");
    }

    @Test
    @DisplayName("Should return at most k matches")
    void shouldReturnAtMostK() {
      for (int i = 0; i < 5; i++) {
        index.insert("a_" + i, new float[] {1, i, 0}, new VectorMetadata(docA, i, 1));
      }

      assertThat(index.search(new float[] {1, 0, 0}, 2, -1.0)).hasSize(2);
      assertThat(index.search(new float[] {1, 0, 0}, 0, -1.0)).isEmpty();
    }

    @Test
    @DisplayName("Should drop matches below the score threshold")
    void shouldDropMatchesBelowThreshold() {
      index.insert("a_0", new float[] {1, 0, 0}, new VectorMetadata(docA, 0, 1));
      index.insert("a_1", new float[] {-1, 0, 0}, new VectorMetadata(docA, 1, 1));

      List<VectorMatch> matches = index.search(new float[] {1, 0, 0}, 5, 0.5);

      assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("a_0");
    }

    @Test
    @DisplayName("Should score zero vectors as zero")
    void shouldScoreZeroVectorsAsZero() {
      index.insert("a_0", new float[] {0, 0, 0}, new VectorMetadata(docA, 0, 1));

      List<VectorMatch> matches = index.search(new float[] {1, 0, 0}, 1, -1.0);

      assertThat(matches.get(0).score()).isZero();
    }

    @Test
    @DisplayName("Should score by inverse distance when configured")
    void shouldScoreByInverseDistance() {
      InMemoryVectorIndex euclidean = new InMemoryVectorIndex(2, SimilarityMetric.INVERSE_DISTANCE);
      euclidean.insert("a_0", new float[] {3, 4}, new VectorMetadata(docA, 0, 1));

      List<VectorMatch> matches = euclidean.search(new float[] {0, 0}, 1, 0.0);

      assertThat(matches.get(0).score()).isCloseTo(1.0 / 6.0, within(1e-9));
    }
  }

  @Test
  @DisplayName("Should reject vectors of the wrong dimension")
  void shouldRejectWrongDimension() {
    assertThatThrownBy(() -> index.insert("a_0", new float[] {1, 0}, new VectorMetadata(docA, 0, 1)))
        .isInstanceOf(DimensionMismatchException.class)
        .hasMessageContaining("3")
        .hasMessageContaining("2");
    assertThatThrownBy(() -> index.search(new float[] {1, 0, 0, 0}, 1, 0.0))
        .isInstanceOf(DimensionMismatchException.class);
  }

  @Test
  @DisplayName("Should delete only the vectors of one document")
  void shouldDeleteOnlyOneDocument() {
    index.insert("a_0", new float[] {1, 0, 0}, new VectorMetadata(docA, 0, 1));
    index.insert("a_1", new float[] {0, 1, 0}, new VectorMetadata(docA, 1, 1));
    index.insert("b_0", new float[] {0, 0, 1}, new VectorMetadata(docB, 0, 1));

    index.delete(docA);
    index.delete(UUID.randomUUID());

    assertThat(index.count(docA)).isZero();
    assertThat(index.count(docB)).isEqualTo(1);
    assertThat(index.search(new float[] {1, 0, 0}, 5, -1.0))
        .extracting(VectorMatch::chunkId)
        .containsExactly("b_0");
  }

  @Test
  @DisplayName("Should hide a document from searches while it is held exclusively")
  void shouldBlockSearchesDuringExclusiveSection() throws Exception {
    index.insert("a_0", new float[] {1, 0, 0}, new VectorMetadata(docA, 0, 1));
    CountDownLatch searchStarted = new CountDownLatch(1);
    CompletableFuture<List<VectorMatch>> search;

    try (IndexLock ignored = index.exclusive(docA)) {
      index.delete(docA);
      search =
          CompletableFuture.supplyAsync(
              () -> {
                searchStarted.countDown();
                return index.search(new float[] {1, 0, 0}, 5, -1.0);
              });
      assertThat(searchStarted.await(5, TimeUnit.SECONDS)).isTrue();
      Thread.sleep(50);
      assertThat(search).isNotDone();

      index.insert("a_0", new float[] {0, 1, 0}, new VectorMetadata(docA, 0, 1));
      index.insert("a_1", new float[] {1, 0, 0}, new VectorMetadata(docA, 1, 1));
    }

    // the search sees the finished rewrite, never the empty partition
    assertThat(search.get(5, TimeUnit.SECONDS))
        .extracting(VectorMatch::chunkId)
        .containsExactly("a_1", "a_0");
  }
}
