package com.flamingo.ai.docqa.service.conversation.export;

import com.flamingo.ai.docqa.domain.enums.ExportFormat;

/** Renders a transcript in one export format. */
public interface TranscriptFormatter {

  ExportFormat format();

  byte[] write(ConversationTranscript transcript);
}
