package com.flamingo.ai.docqa.service.conversation.export;

import com.flamingo.ai.docqa.domain.enums.ExportFormat;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** Human-readable plain text transcripts. */
@Component
public class PlainTextTranscriptFormatter implements TranscriptFormatter {

  @Override
  public ExportFormat format() {
    return ExportFormat.TEXT;
  }

  @Override
  public byte[] write(ConversationTranscript transcript) {
    StringBuilder out = new StringBuilder();
    out.append("Conversation: ").append(titleOf(transcript)).append('\n');
    out.append("Started: ").append(transcript.createdAt()).append("\n\n");

    for (ConversationTranscript.Entry turn : transcript.turns()) {
      out.append(turn.role()).append(" (").append(turn.createdAt()).append("):\n");
      if (turn.status() == TurnStatus.FAILED) {
        out.append("[failed: ").append(turn.failureReason()).append("]\n");
      } else {
        out.append(turn.text()).append('\n');
      }
      for (SourceCitation citation : turn.citations()) {
        out.append("  [")
            .append(citation.marker())
            .append("] ")
            .append(citation.chunkId())
            .append(String.format(" (score %.3f)", citation.score()))
            .append('\n');
      }
      out.append('\n');
    }
    return out.toString().getBytes(StandardCharsets.UTF_8);
  }

  static String titleOf(ConversationTranscript transcript) {
    return transcript.title() == null || transcript.title().isBlank()
        ? transcript.conversationId().toString()
        : transcript.title();
  }
}
