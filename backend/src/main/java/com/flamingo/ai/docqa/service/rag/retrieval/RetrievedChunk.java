package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.domain.entity.Chunk;

/** A chunk resolved from a vector match, with the score it matched with. */
public record RetrievedChunk(Chunk chunk, double score) {}
