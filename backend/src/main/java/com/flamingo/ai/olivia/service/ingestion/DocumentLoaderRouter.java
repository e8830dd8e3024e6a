package com.flamingo.ai.olivia.service.ingestion;

import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Picks a loader by file extension and applies the fallback chain.
 *
 * <ul>
 *   <li>{@code .pdf}: PDFBox, then Tika if PDFBox found no text (scanned or image-only PDFs).
 *   <li>{@code .txt}: plain text.
 *   <li>markup ({@code .md .rst .html .htm .xml}): Tika.
 *   <li>anything else: plain text, then Tika if the bytes are not UTF-8 text.
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentLoaderRouter {

  static final Set<String> MARKUP_EXTENSIONS = Set.of(".md", ".rst", ".html", ".htm", ".xml");

  private final PdfBoxDocumentLoader pdfLoader;
  private final PlainTextDocumentLoader textLoader;
  private final TikaDocumentLoader genericLoader;

  public List<LoadedPage> load(Path file) {
    String extension = extension(file.getFileName().toString());
    if (".pdf".equals(extension)) {
      List<LoadedPage> pages = pdfLoader.load(file);
      if (DocumentLoader.totalChars(pages) == 0) {
        log.warn("PDFBox returned no text for {}, trying generic extractor", file.getFileName());
        return genericLoader.load(file);
      }
      return pages;
    }
    if (".txt".equals(extension)) {
      return textLoader.load(file);
    }
    if (MARKUP_EXTENSIONS.contains(extension)) {
      return genericLoader.load(file);
    }
    try {
      return textLoader.load(file);
    } catch (DocumentProcessingException e) {
      log.debug(
          "{} is not plain text ({}), trying generic extractor",
          file.getFileName(),
          e.getMessage());
      return genericLoader.load(file);
    }
  }

  /** Lower-cased extension including the dot, or empty when there is none. */
  public static String extension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
  }
}
