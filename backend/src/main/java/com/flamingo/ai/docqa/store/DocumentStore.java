package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence of document records and their chunk records. */
public interface DocumentStore {

  Document save(Document document);

  Optional<Document> findById(UUID documentId);

  /** All documents, newest first. */
  List<Document> findAll();

  void delete(UUID documentId);

  /** Replaces every chunk record of a document with {@code chunks}. */
  void replaceChunks(UUID documentId, List<Chunk> chunks);

  /** Finds chunks by identifier; unknown identifiers are ignored. */
  List<Chunk> findChunks(Collection<String> chunkIds);

  /** Chunks of a document in sequence order. */
  List<Chunk> findChunksByDocument(UUID documentId);

  void deleteChunks(UUID documentId);
}
