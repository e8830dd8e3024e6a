package com.flamingo.ai.olivia.api.dto.response;

import com.flamingo.ai.olivia.service.document.UploadTicket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
  private String taskId;
  private String filename;

  public static UploadResponse fromTicket(UploadTicket ticket) {
    return new UploadResponse(ticket.taskId(), ticket.filename());
  }
}
