package com.flamingo.ai.docqa.service.rag.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.exception.TextExtractionException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TikaTextExtractor Tests")
class TikaTextExtractorTest {

  private final TikaTextExtractor extractor = new TikaTextExtractor();

  @Test
  @DisplayName("Should extract plain text")
  void shouldExtractPlainText() {
    String text =
        extractor.extract(
            "The sky is blue.".getBytes(StandardCharsets.UTF_8), "text/plain", "sky.txt");

    assertThat(text).contains("The sky is blue.");
  }

  @Test
  @DisplayName("Should extract the visible text of HTML")
  void shouldExtractHtml() {
    byte[] html =
        "<html><body><h1>Colors</h1><p>Grass is green.</p></body></html>"
            .getBytes(StandardCharsets.UTF_8);

    String text = extractor.extract(html, "text/html", "colors.html");

    assertThat(text).contains("Colors").contains("Grass is green.").doesNotContain("<p>");
  }

  @Test
  @DisplayName("Should fail on empty input")
  void shouldFailOnEmptyInput() {
    assertThatThrownBy(() -> extractor.extract(new byte[0], "text/plain", "empty.txt"))
        .isInstanceOf(TextExtractionException.class);
  }
}
