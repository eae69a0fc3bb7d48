package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds all documents, newest first. */
  List<Document> findAllByOrderByCreatedAtDesc();
}
