package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.ChunkRepository;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/** Document store on the relational database. */
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

  private final DocumentRepository documentRepository;
  private final ChunkRepository chunkRepository;

  @Override
  @Transactional
  public Document save(Document document) {
    return documentRepository.save(document);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Document> findById(UUID documentId) {
    return documentRepository.findById(documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> findAll() {
    return documentRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional
  public void delete(UUID documentId) {
    documentRepository.deleteById(documentId);
  }

  @Override
  @Transactional
  public void replaceChunks(UUID documentId, List<Chunk> chunks) {
    chunkRepository.deleteByDocumentId(documentId);
    chunkRepository.saveAll(chunks);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Chunk> findChunks(Collection<String> chunkIds) {
    return chunkIds.isEmpty() ? List.of() : chunkRepository.findByIdIn(chunkIds);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Chunk> findChunksByDocument(UUID documentId) {
    return chunkRepository.findByDocumentIdOrderBySequenceIndexAsc(documentId);
  }

  @Override
  @Transactional
  public void deleteChunks(UUID documentId) {
    chunkRepository.deleteByDocumentId(documentId);
  }
}
