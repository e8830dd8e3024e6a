package com.flamingo.ai.olivia.service.ingestion;

/**
 * A piece of a page produced by the splitter.
 *
 * @param startIndex offset of the chunk's first character within the page text
 */
public record TextChunk(String content, int page, int startIndex) {}
