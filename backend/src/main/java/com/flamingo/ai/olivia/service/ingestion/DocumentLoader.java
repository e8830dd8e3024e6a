package com.flamingo.ai.olivia.service.ingestion;

import java.nio.file.Path;
import java.util.List;

/**
 * Extracts text from a stored file.
 *
 * <p>Implementations must be stateless so one instance serves concurrent ingestion threads.
 */
public interface DocumentLoader {

  /**
   * Loads the file's text, page by page.
   *
   * @throws com.flamingo.ai.olivia.exception.DocumentProcessingException if the file cannot be
   *     read in this format
   */
  List<LoadedPage> load(Path file);

  static int totalChars(List<LoadedPage> pages) {
    return pages.stream().mapToInt(page -> page.text().length()).sum();
  }
}
