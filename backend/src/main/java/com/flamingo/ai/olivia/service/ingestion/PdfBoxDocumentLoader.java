package com.flamingo.ai.olivia.service.ingestion;

import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts the text layer of a PDF one page at a time with Apache PDFBox. */
@Component
@Slf4j
public class PdfBoxDocumentLoader implements DocumentLoader {

  @Override
  public List<LoadedPage> load(Path file) {
    try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      int pageCount = pdf.getNumberOfPages();
      List<LoadedPage> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(new LoadedPage(stripper.getText(pdf), page));
      }
      log.debug("PDFBox extracted {} pages from {}", pageCount, file.getFileName());
      return pages;
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", file.getFileName(), e.getMessage());
      throw new DocumentProcessingException(
          file.getFileName().toString(), "Failed to parse PDF: " + e.getMessage(), e);
    }
  }
}
