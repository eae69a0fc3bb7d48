package com.flamingo.ai.docqa.service.conversation.export;

import com.flamingo.ai.docqa.domain.enums.ExportFormat;
import com.flamingo.ai.docqa.domain.enums.MessageRole;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** Markdown transcripts with a sources list under each answer. */
@Component
public class MarkdownTranscriptFormatter implements TranscriptFormatter {

  @Override
  public ExportFormat format() {
    return ExportFormat.MARKDOWN;
  }

  @Override
  public byte[] write(ConversationTranscript transcript) {
    StringBuilder out = new StringBuilder();
    out.append("# ").append(PlainTextTranscriptFormatter.titleOf(transcript)).append("\n\n");
    out.append("_Started ").append(transcript.createdAt()).append("_\n\n");

    for (ConversationTranscript.Entry turn : transcript.turns()) {
      out.append("### ")
          .append(turn.role() == MessageRole.USER ? "Question" : "Answer")
          .append("\n\n");
      if (turn.status() == TurnStatus.FAILED) {
        out.append("> Answer failed: ").append(turn.failureReason()).append("\n\n");
        continue;
      }
      out.append(turn.text()).append("\n\n");
      if (!turn.citations().isEmpty()) {
        out.append("**Sources**\n\n");
        for (SourceCitation citation : turn.citations()) {
          out.append("- [")
              .append(citation.marker())
              .append("] `")
              .append(citation.chunkId())
              .append("`\n");
        }
        out.append('\n');
      }
    }
    return out.toString().getBytes(StandardCharsets.UTF_8);
  }
}
