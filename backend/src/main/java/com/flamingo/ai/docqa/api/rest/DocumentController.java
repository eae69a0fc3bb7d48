package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.api.dto.response.ChunkResponse;
import com.flamingo.ai.docqa.api.dto.response.DocumentResponse;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.service.document.DocumentService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document management. Ingestion runs in the background. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a document and starts ingesting it. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(@RequestParam("file") MultipartFile file) {
    Document document = documentService.uploadDocument(file);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets all documents, newest first. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> getAllDocuments() {
    return ResponseEntity.ok(
        documentService.getAllDocuments().stream().map(DocumentResponse::fromEntity).toList());
  }

  /** Gets a document, including its ingestion status. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(documentService.getDocument(documentId)));
  }

  /** Gets the chunks of a document in sequence order. */
  @GetMapping("/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable UUID documentId) {
    return ResponseEntity.ok(
        documentService.getChunks(documentId).stream().map(ChunkResponse::fromEntity).toList());
  }

  /** Replaces a document's content with a new revision. */
  @PostMapping(value = "/{documentId}/reingest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> reingestDocument(
      @PathVariable UUID documentId, @RequestParam("file") MultipartFile file) {
    Document document = documentService.reingestDocument(documentId, file);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromEntity(document));
  }

  /** Cancels a running ingestion. */
  @PostMapping("/{documentId}/cancel")
  public ResponseEntity<Void> cancelIngestion(@PathVariable UUID documentId) {
    return documentService.cancelIngestion(documentId)
        ? ResponseEntity.accepted().build()
        : ResponseEntity.status(HttpStatus.CONFLICT).build();
  }

  /** Deletes a document. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }
}
