package com.flamingo.ai.docqa.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

/** Stores a turn's citations as a JSON array, preserving their order. */
@Converter
public class CitationListConverter implements AttributeConverter<List<SourceCitation>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<SourceCitation>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<SourceCitation> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize citations", e);
    }
  }

  @Override
  public List<SourceCitation> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return List.of();
    }
    try {
      return List.copyOf(MAPPER.readValue(dbData, LIST_TYPE));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize citations", e);
    }
  }
}
