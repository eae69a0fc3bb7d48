package com.flamingo.ai.docqa.service.rag.index;

import java.util.UUID;

/**
 * Metadata stored next to a vector so that deletes can target a whole document and matches can
 * be checked against the chunk record of the same revision.
 */
public record VectorMetadata(UUID documentId, int sequenceIndex, int revision) {}
