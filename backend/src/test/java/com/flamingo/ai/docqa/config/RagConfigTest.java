package com.flamingo.ai.docqa.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.exception.InvalidConfigException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RagConfig Tests")
class RagConfigTest {

  @Test
  @DisplayName("Should accept the defaults")
  void shouldAcceptDefaults() {
    assertThatCode(() -> new RagConfig().validate()).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Should name the property when overlap is not smaller than size")
  void shouldRejectOverlapAtLeastSize() {
    RagConfig config = new RagConfig();
    config.getChunking().setSize(100);
    config.getChunking().setOverlap(100);

    assertThatThrownBy(config::validate)
        .isInstanceOfSatisfying(
            InvalidConfigException.class,
            e -> assertThat(e.getProperty())
                .isEqualTo("rag.chunking.overlap"));
  }

  @Test
  @DisplayName("Should reject a non-positive top-k")
  void shouldRejectNonPositiveTopK() {
    RagConfig config = new RagConfig();
    config.getRetrieval().setTopK(0);

    assertThatThrownBy(config::validate).hasMessageContaining("rag.retrieval.top-k");
  }

  @Test
  @DisplayName("Should reject a non-finite score threshold")
  void shouldRejectNonFiniteThreshold() {
    RagConfig config = new RagConfig();
    config.getRetrieval().setScoreThreshold(Double.NaN);

    assertThatThrownBy(config::validate).hasMessageContaining("rag.retrieval.score-threshold");
  }

  @Test
  @DisplayName("Should reject retry settings that cannot work")
  void shouldRejectBrokenRetry() {
    RagConfig config = new RagConfig();
    config.getEmbedding().getRetry().setJitter(1.0);

    assertThatThrownBy(config::validate).hasMessageContaining("rag.embedding.retry.jitter");

    config.getEmbedding().getRetry().setJitter(0.1);
    config.getGeneration().getRetry().setMaxAttempts(0);

    assertThatThrownBy(config::validate).hasMessageContaining("rag.generation.retry.max-attempts");
  }

  @Test
  @DisplayName("Should reject a zero generation timeout")
  void shouldRejectZeroTimeout() {
    RagConfig config = new RagConfig();
    config.getGeneration().setTimeout(Duration.ZERO);

    assertThatThrownBy(config::validate).hasMessageContaining("rag.generation.timeout");
  }
}
