package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Document store held in memory. Documents go in and out as copies. */
public class InMemoryDocumentStore implements DocumentStore {

  private final Map<UUID, Document> documents = new ConcurrentHashMap<>();
  private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();

  @Override
  public Document save(Document document) {
    documents.put(document.getId(), document.copy());
    return document;
  }

  @Override
  public Optional<Document> findById(UUID documentId) {
    return Optional.ofNullable(documents.get(documentId)).map(Document::copy);
  }

  @Override
  public List<Document> findAll() {
    return documents.values().stream()
        .sorted(Comparator.comparing(Document::getCreatedAt).reversed())
        .map(Document::copy)
        .toList();
  }

  @Override
  public void delete(UUID documentId) {
    documents.remove(documentId);
  }

  @Override
  public void replaceChunks(UUID documentId, List<Chunk> replacement) {
    deleteChunks(documentId);
    for (Chunk chunk : replacement) {
      chunks.put(chunk.getId(), chunk.toBuilder().build());
    }
  }

  @Override
  public List<Chunk> findChunks(Collection<String> chunkIds) {
    List<Chunk> found = new ArrayList<>(chunkIds.size());
    for (String id : chunkIds) {
      Chunk chunk = chunks.get(id);
      if (chunk != null) {
        found.add(chunk.toBuilder().build());
      }
    }
    return found;
  }

  @Override
  public List<Chunk> findChunksByDocument(UUID documentId) {
    return chunks.values().stream()
        .filter(chunk -> chunk.getDocumentId().equals(documentId))
        .sorted(Comparator.comparingInt(Chunk::getSequenceIndex))
        .map(chunk -> chunk.toBuilder().build())
        .toList();
  }

  @Override
  public void deleteChunks(UUID documentId) {
    chunks.values().removeIf(chunk -> chunk.getDocumentId().equals(documentId));
  }
}
