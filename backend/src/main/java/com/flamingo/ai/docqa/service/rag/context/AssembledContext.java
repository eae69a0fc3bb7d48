package com.flamingo.ai.docqa.service.rag.context;

import com.flamingo.ai.docqa.domain.model.SourceCitation;
import java.util.List;

/**
 * Context text handed to the model together with the citations its markers refer to.
 *
 * @param text numbered chunk texts, e.g. {@code "[1] ...\n\n[2] ..."}
 * @param citations one citation per marker, in marker order
 * @param estimatedTokens estimated size of {@code text}
 * @param skippedDuplicates chunks left out because an included chunk already contains them
 */
public record AssembledContext(
    String text, List<SourceCitation> citations, int estimatedTokens, int skippedDuplicates) {

  public boolean isEmpty() {
    return citations.isEmpty();
  }
}
