package com.flamingo.ai.olivia.service.ingestion;

import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/**
 * Generic extractor for markup and unknown formats, backed by Apache Tika's auto-detecting
 * parser. Page structure is lost; the whole text is page 1.
 */
@Component
@Slf4j
public class TikaDocumentLoader implements DocumentLoader {

  private static final Tika TIKA = new Tika();

  static {
    TIKA.setMaxStringLength(-1);
  }

  @Override
  public List<LoadedPage> load(Path file) {
    try {
      String text = TIKA.parseToString(file);
      return List.of(new LoadedPage(text != null ? text : "", 1));
    } catch (IOException | TikaException e) {
      log.error("Tika extraction failed for {}: {}", file.getFileName(), e.getMessage());
      throw new DocumentProcessingException(
          file.getFileName().toString(), "Failed to extract text: " + e.getMessage(), e);
    }
  }
}
