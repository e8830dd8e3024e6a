package com.flamingo.ai.olivia.service.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ingestion progress update as pushed to subscribers.
 *
 * @param progress percent complete, or {@code -1} once the task failed
 */
public record ProgressEvent(
    String type,
    int progress,
    String message,
    @JsonProperty("task_id") String taskId,
    long timestamp) {

  public static final String TYPE = "progress";
  public static final int FAILED = -1;

  public static ProgressEvent of(int progress, String message, String taskId, long timestamp) {
    return new ProgressEvent(TYPE, progress, message, taskId, timestamp);
  }
}
