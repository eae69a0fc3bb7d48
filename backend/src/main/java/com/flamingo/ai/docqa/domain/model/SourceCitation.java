package com.flamingo.ai.docqa.domain.model;

import java.util.UUID;

/**
 * Attribution of an answer to a retrieved chunk.
 *
 * @param marker 1-based marker index used in the prompt, e.g. {@code [2]}
 * @param documentId the document the chunk belongs to
 * @param chunkId the chunk identifier
 * @param score similarity score reported by the vector index
 */
public record SourceCitation(int marker, UUID documentId, String chunkId, double score) {}
