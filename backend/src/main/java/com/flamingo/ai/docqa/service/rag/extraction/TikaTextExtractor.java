package com.flamingo.ai.docqa.service.rag.extraction;

import com.flamingo.ai.docqa.exception.TextExtractionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/** Extracts text from PDF, Office, EPUB, HTML and plain text files with Apache Tika. */
@Component
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  private final AutoDetectParser parser = new AutoDetectParser();

  @Override
  public String extract(byte[] content, String mimeType, String fileName) {
    if (content == null || content.length == 0) {
      throw new TextExtractionException("Document is empty");
    }

    Metadata metadata = new Metadata();
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }
    BodyContentHandler handler = new BodyContentHandler(-1);

    try (InputStream input = new ByteArrayInputStream(content)) {
      parser.parse(input, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.warn("Text extraction failed for {} ({}): {}", fileName, mimeType, e.getMessage());
      throw new TextExtractionException("Failed to extract text: " + e.getMessage(), e);
    }

    String text = handler.toString().strip();
    if (text.isEmpty()) {
      throw new TextExtractionException("No text content found in " + fileName);
    }
    log.debug("Extracted {} chars from {} ({})", text.length(), fileName, mimeType);
    return text;
  }
}
