package com.flamingo.ai.docqa.service.conversation.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.docqa.domain.enums.ExportFormat;
import java.io.IOException;
import org.springframework.stereotype.Component;

/** JSON transcripts. The only format that can be imported back. */
@Component
public class JsonTranscriptFormatter implements TranscriptFormatter {

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(SerializationFeature.INDENT_OUTPUT);

  @Override
  public ExportFormat format() {
    return ExportFormat.JSON;
  }

  @Override
  public byte[] write(ConversationTranscript transcript) {
    try {
      return objectMapper.writeValueAsBytes(transcript);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize conversation transcript", e);
    }
  }

  /**
   * @throws IllegalArgumentException if {@code data} is not a valid transcript
   */
  public ConversationTranscript read(byte[] data) {
    ConversationTranscript transcript;
    try {
      transcript = objectMapper.readValue(data, ConversationTranscript.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid conversation transcript: " + e.getMessage(), e);
    }
    if (transcript == null || transcript.conversationId() == null) {
      throw new IllegalArgumentException("Invalid conversation transcript: missing conversationId");
    }
    if (transcript.version() > ConversationTranscript.CURRENT_VERSION) {
      throw new IllegalArgumentException(
          "Unsupported transcript version " + transcript.version());
    }
    return transcript;
  }
}
