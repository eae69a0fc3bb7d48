package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.api.dto.request.AskRequest;
import com.flamingo.ai.docqa.api.dto.request.CreateConversationRequest;
import com.flamingo.ai.docqa.api.dto.response.ConversationResponse;
import com.flamingo.ai.docqa.api.dto.response.TurnResponse;
import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.enums.ExportFormat;
import com.flamingo.ai.docqa.service.conversation.ConversationManager;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import com.flamingo.ai.docqa.service.rag.pipeline.RagOrchestrator;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for conversations and question answering. */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

  private final RagOrchestrator ragOrchestrator;
  private final ConversationManager conversationManager;
  private final RagConfig ragConfig;

  /** Starts a new conversation. */
  @PostMapping
  public ResponseEntity<ConversationResponse> createConversation(
      @Valid @RequestBody(required = false) CreateConversationRequest request) {
    String title = request == null ? null : request.getTitle();
    Conversation conversation = ragOrchestrator.startConversation(title);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ConversationResponse.fromEntity(conversation));
  }

  /** Gets all conversations, newest first. */
  @GetMapping
  public ResponseEntity<List<ConversationResponse>> getAllConversations() {
    return ResponseEntity.ok(
        conversationManager.list().stream().map(ConversationResponse::fromEntity).toList());
  }

  /** Gets a conversation header. */
  @GetMapping("/{conversationId}")
  public ResponseEntity<ConversationResponse> getConversation(@PathVariable UUID conversationId) {
    return ResponseEntity.ok(ConversationResponse.fromEntity(conversationManager.get(conversationId)));
  }

  /** Gets the turns of a conversation in order. */
  @GetMapping("/{conversationId}/turns")
  public ResponseEntity<List<TurnResponse>> getTurns(@PathVariable UUID conversationId) {
    return ResponseEntity.ok(
        conversationManager.history(conversationId).stream().map(TurnResponse::fromEntity).toList());
  }

  /**
   * Asks a question. The answer turn is returned even when answering failed; check its status.
   */
  @PostMapping("/{conversationId}/ask")
  public ResponseEntity<TurnResponse> ask(
      @PathVariable UUID conversationId, @Valid @RequestBody AskRequest request) {
    // leave headroom over the generation timeout for embedding and retrieval
    Duration deadline = ragConfig.getGeneration().getTimeout().multipliedBy(2);
    Turn answer =
        ragOrchestrator.ask(
            conversationId, request.getQuestion(), CancellationToken.withTimeout(deadline));
    return ResponseEntity.ok(TurnResponse.fromEntity(answer));
  }

  /** Exports a conversation as JSON, plain text or Markdown. */
  @GetMapping("/{conversationId}/export")
  public ResponseEntity<byte[]> export(
      @PathVariable UUID conversationId,
      @RequestParam(name = "format", required = false) String format) {
    ExportFormat exportFormat = ExportFormat.fromName(format);
    byte[] body = conversationManager.export(conversationId, exportFormat);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(exportFormat.getContentType() + ";charset=UTF-8"))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename("conversation-" + conversationId + "." + exportFormat.getFileExtension())
                .build()
                .toString())
        .body(body);
  }

  /** Imports a conversation previously exported as JSON. */
  @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ConversationResponse> importConversation(@RequestBody byte[] transcript) {
    Conversation conversation = conversationManager.importJson(transcript);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ConversationResponse.fromEntity(conversation));
  }
}
