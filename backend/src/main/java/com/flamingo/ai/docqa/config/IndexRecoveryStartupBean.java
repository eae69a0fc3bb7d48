package com.flamingo.ai.docqa.config;

import com.flamingo.ai.docqa.service.rag.pipeline.IngestionJob;
import com.flamingo.ai.docqa.service.rag.pipeline.RagOrchestrator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that brings the vector index back in line with the document store.
 *
 * <p>Runs once on application startup and:
 *
 * <ul>
 *   <li>Fails documents whose ingestion was interrupted by the previous shutdown
 *   <li>Re-embeds indexed documents whose vectors are missing, e.g. with the in-memory index
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexRecoveryStartupBean implements CommandLineRunner {

  private final RagOrchestrator ragOrchestrator;

  @Override
  public void run(String... args) {
    log.info("Checking stored documents against the vector index...");
    List<IngestionJob> restores = ragOrchestrator.recover();
    if (restores.isEmpty()) {
      log.info("Vector index is up to date, nothing to restore");
    } else {
      log.info("Restoring vectors for {} documents in the background", restores.size());
    }
  }
}
