package com.flamingo.ai.docqa.service.rag.context;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievedChunk;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Packs ranked chunks into a numbered context that fits a token budget.
 *
 * <p>Chunks are taken in the given order. A chunk whose text is contained in the text of an
 * already included chunk of the same document is skipped, whether or not their offsets overlap. Assembly stops at the first chunk that would push the estimate
 * over the budget.
 */
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

  static final String SEPARATOR = "\n\n";

  private final TokenEstimator tokenEstimator;

  public AssembledContext assemble(List<RetrievedChunk> ranked, int tokenBudget) {
    StringBuilder context = new StringBuilder();
    List<SourceCitation> citations = new ArrayList<>();
    Map<UUID, List<Chunk>> includedByDocument = new HashMap<>();
    int skippedDuplicates = 0;
    int estimate = 0;

    for (RetrievedChunk candidate : ranked) {
      Chunk chunk = candidate.chunk();
      if (isCovered(chunk, includedByDocument.get(chunk.getDocumentId()))) {
        skippedDuplicates++;
        continue;
      }

      int marker = citations.size() + 1;
      String block =
          (context.length() == 0 ? "" : SEPARATOR) + "[" + marker + "] " + chunk.getText();
      int withBlock = tokenEstimator.estimate(context + block);
      if (withBlock > tokenBudget) {
        log.debug(
            "Context budget of {} tokens reached after {} chunks", tokenBudget, citations.size());
        break;
      }

      context.append(block);
      estimate = withBlock;
      citations.add(
          new SourceCitation(marker, chunk.getDocumentId(), chunk.getId(), candidate.score()));
      includedByDocument.computeIfAbsent(chunk.getDocumentId(), id -> new ArrayList<>()).add(chunk);
    }

    return new AssembledContext(context.toString(), List.copyOf(citations), estimate, skippedDuplicates);
  }

  private static boolean isCovered(Chunk chunk, List<Chunk> included) {
    if (included == null) {
      return false;
    }
    for (Chunk other : included) {
      boolean withinSpan =
          other.getStartOffset() <= chunk.getStartOffset()
              && chunk.getEndOffset() <= other.getEndOffset();
      if (withinSpan || other.getText().contains(chunk.getText())) {
        return true;
      }
    }
    return false;
  }
}
