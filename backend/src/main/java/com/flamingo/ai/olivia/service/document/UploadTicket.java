package com.flamingo.ai.olivia.service.document;

/** Handle returned for an accepted upload; progress is published under {@code taskId}. */
public record UploadTicket(String taskId, String filename) {}
