package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Chunk records. */
@Repository
public interface ChunkRepository extends JpaRepository<Chunk, String> {

  /** Finds the chunks of a document in sequence order. */
  List<Chunk> findByDocumentIdOrderBySequenceIndexAsc(UUID documentId);

  /** Finds chunks by identifier, in no particular order. */
  List<Chunk> findByIdIn(Collection<String> ids);

  /** Deletes all chunks of a document. */
  @Modifying
  @Query("DELETE FROM Chunk c WHERE c.documentId = :documentId")
  int deleteByDocumentId(@Param("documentId") UUID documentId);
}
