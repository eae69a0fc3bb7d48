package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for document management. */
public interface DocumentService {

  /**
   * Validates an upload and starts ingesting it.
   *
   * @param file the uploaded file
   * @return the created document, in {@code UPLOADED} status
   * @throws com.flamingo.ai.docqa.exception.DocumentProcessingException if the file is rejected
   */
  Document uploadDocument(MultipartFile file);

  /**
   * Uploads new content for an existing document.
   *
   * @throws com.flamingo.ai.docqa.exception.DocumentNotFoundException if not found
   */
  Document reingestDocument(UUID documentId, MultipartFile file);

  /**
   * Gets a document by ID.
   *
   * @throws com.flamingo.ai.docqa.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  List<Document> getAllDocuments();

  List<Chunk> getChunks(UUID documentId);

  /** Cancels a running ingestion; returns whether one was running. */
  boolean cancelIngestion(UUID documentId);

  /** Deletes a document with its chunks and vectors. */
  void deleteDocument(UUID documentId);
}
