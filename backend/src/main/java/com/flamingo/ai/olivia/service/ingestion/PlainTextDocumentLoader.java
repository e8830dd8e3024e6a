package com.flamingo.ai.olivia.service.ingestion;

import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Reads the file as strict UTF-8; undecodable bytes fail the load. */
@Component
public class PlainTextDocumentLoader implements DocumentLoader {

  @Override
  public List<LoadedPage> load(Path file) {
    try {
      return List.of(new LoadedPage(Files.readString(file, StandardCharsets.UTF_8), 1));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.getFileName().toString(), "Failed to read text: " + e.getMessage(), e);
    }
  }
}
