package com.flamingo.ai.docqa.service.document;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.exception.DocumentProcessingException;
import com.flamingo.ai.docqa.service.rag.pipeline.IngestionJob;
import com.flamingo.ai.docqa.service.rag.pipeline.RagOrchestrator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of(
          "application/pdf",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/epub+zip",
          "text/html",
          "text/markdown",
          "text/plain");

  private final RagOrchestrator ragOrchestrator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.upload", description = "Time to accept a document upload")
  public Document uploadDocument(MultipartFile file) {
    validateFile(null, file);
    IngestionJob job =
        ragOrchestrator.ingest(file.getOriginalFilename(), file.getContentType(), readBytes(null, file));
    meterRegistry.counter("documents.uploaded").increment();
    return ragOrchestrator.getDocument(job.getDocumentId());
  }

  @Override
  public Document reingestDocument(UUID documentId, MultipartFile file) {
    validateFile(documentId, file);
    IngestionJob job =
        ragOrchestrator.reingest(documentId, file.getContentType(), readBytes(documentId, file));
    return ragOrchestrator.getDocument(job.getDocumentId());
  }

  @Override
  public Document getDocument(UUID documentId) {
    return ragOrchestrator.getDocument(documentId);
  }

  @Override
  public List<Document> getAllDocuments() {
    return ragOrchestrator.listDocuments();
  }

  @Override
  public List<Chunk> getChunks(UUID documentId) {
    return ragOrchestrator.getChunks(documentId);
  }

  @Override
  public boolean cancelIngestion(UUID documentId) {
    return ragOrchestrator.cancelIngestion(documentId);
  }

  @Override
  public void deleteDocument(UUID documentId) {
    ragOrchestrator.removeDocument(documentId);
    meterRegistry.counter("documents.deleted").increment();
  }

  private void validateFile(UUID documentId, MultipartFile file) {
    if (file.isEmpty()) {
      throw new DocumentProcessingException(
          documentId, "File is empty", "Please upload a valid file");
    }

    String contentType = file.getContentType();
    if (contentType == null || !SUPPORTED_MIME_TYPES.contains(contentType)) {
      throw new DocumentProcessingException(
          documentId,
          "Unsupported file type: " + contentType,
          "Supported formats: PDF, DOCX, EPUB, HTML, Markdown, TXT");
    }

    long maxBytes = ragConfig.getIngestion().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new DocumentProcessingException(
          documentId,
          "File too large: " + file.getSize(),
          "Maximum file size is " + maxBytes / (1024 * 1024) + "MB");
    }
  }

  private byte[] readBytes(UUID documentId, MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read upload {}: {}", file.getOriginalFilename(), e.getMessage(), e);
      throw new DocumentProcessingException(
          documentId, "Failed to read upload: " + e.getMessage(), "Failed to read the uploaded file");
    }
  }
}
