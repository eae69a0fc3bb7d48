package com.flamingo.ai.docqa.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jEmbeddingGateway Tests")
class LangChain4jEmbeddingGatewayTest {

  @Mock private EmbeddingModel embeddingModel;

  private MeterRegistry meterRegistry;
  private LangChain4jEmbeddingGateway gateway;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    gateway = new LangChain4jEmbeddingGateway(embeddingModel, meterRegistry, 2, 2);
  }

  @Test
  @DisplayName("Should embed in batches and keep input order")
  @SuppressWarnings("unchecked")
  void shouldEmbedInBatchesAndKeepOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(response(new float[] {1, 0}, new float[] {0, 1}))
        .thenReturn(response(new float[] {1, 1}));

    List<float[]> vectors = gateway.embed(List.of("a", "b", "c"));

    assertThat(vectors).hasSize(3);
    assertThat(vectors.get(2)).containsExactly(1f, 1f);
    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel, times(2)).embedAll(captor.capture());
    assertThat(captor.getAllValues().get(0)).extracting(TextSegment::text).containsExactly("a", "b");
    assertThat(captor.getAllValues().get(1)).extracting(TextSegment::text).containsExactly("c");
    assertThat(meterRegistry.counter("embedding.requests.success").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should truncate very long text")
  @SuppressWarnings("unchecked")
  void shouldTruncateVeryLongText() {
    when(embeddingModel.embedAll(anyList())).thenReturn(response(new float[] {1, 0}));

    gateway.embedQuery("a".repeat(6000));

    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue().get(0).text()).hasSize(5000);
  }

  @Test
  @DisplayName("Should report model failures as unavailable")
  void shouldReportModelFailuresAsUnavailable() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("connection refused"));

    assertThatThrownBy(() -> gateway.embed(List.of("a")))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessageContaining("connection refused");
    assertThat(meterRegistry.counter("embedding.requests.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject vectors of the wrong dimension")
  void shouldRejectWrongDimension() {
    when(embeddingModel.embedAll(anyList())).thenReturn(response(new float[] {1, 0, 0}));

    assertThatThrownBy(() -> gateway.embed(List.of("a")))
        .isInstanceOf(DimensionMismatchException.class);
  }

  @Test
  @DisplayName("Should reject a response with a missing vector")
  void shouldRejectMissingVector() {
    when(embeddingModel.embedAll(anyList())).thenReturn(response(new float[] {1, 0}));

    assertThatThrownBy(() -> gateway.embed(List.of("a", "b")))
        .isInstanceOf(ModelUnavailableException.class);
  }

  private static Response<List<Embedding>> response(float[]... vectors) {
    return Response.from(Arrays.stream(vectors).map(Embedding::from).toList());
  }
}
