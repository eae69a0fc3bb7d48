package com.flamingo.ai.docqa.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 10000, message = "Question must be at most 10000 characters")
  private String question;
}
