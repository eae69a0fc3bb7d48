package com.flamingo.ai.docqa.service.rag.extraction;

/** Converts an uploaded file to plain text. */
@FunctionalInterface
public interface TextExtractor {

  /**
   * @param content raw file bytes
   * @param mimeType declared content type, may be {@code null}
   * @param fileName original file name, used as a detection hint
   * @return the extracted text, never blank
   * @throws com.flamingo.ai.docqa.exception.TextExtractionException if no text can be extracted
   */
  String extract(byte[] content, String mimeType, String fileName);
}
