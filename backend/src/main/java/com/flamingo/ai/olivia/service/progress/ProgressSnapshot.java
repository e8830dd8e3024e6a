package com.flamingo.ai.olivia.service.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Latest progress of a task as read by polling clients. */
public record ProgressSnapshot(
    int progress,
    String message,
    @JsonProperty("isProcessing") boolean isProcessing,
    long timestamp) {

  /** Reported for tasks that have not published anything yet, or whose record expired. */
  public static ProgressSnapshot unknown() {
    return new ProgressSnapshot(0, "Processing", true, 0L);
  }
}
