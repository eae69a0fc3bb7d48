package com.flamingo.ai.docqa.exception;

/** Exception signalling that the vector index references a chunk the document store lacks. */
public class ChunkNotFoundException extends RuntimeException {

  private final String chunkId;

  public ChunkNotFoundException(String chunkId) {
    super("Chunk not found: " + chunkId);
    this.chunkId = chunkId;
  }

  public String getChunkId() {
    return chunkId;
  }
}
