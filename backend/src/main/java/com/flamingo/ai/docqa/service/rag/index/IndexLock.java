package com.flamingo.ai.docqa.service.rag.index;

/**
 * Exclusive write section over one document's vectors. While held, searches never observe a
 * partially replaced document.
 */
public interface IndexLock extends AutoCloseable {

  @Override
  void close();
}
