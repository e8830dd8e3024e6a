package com.flamingo.ai.olivia.service.ingestion;

/**
 * Text of one page of a source file.
 *
 * @param page 1-based page number; formats without pages yield a single page 1
 */
public record LoadedPage(String text, int page) {}
