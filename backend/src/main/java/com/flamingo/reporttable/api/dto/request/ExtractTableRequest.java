package com.flamingo.reporttable.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for extracting a table from an HTML document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractTableRequest {

  @NotNull(message = "HTML content is required")
  private String html;

  /** 1-based table occurrence to start from; the configured default when absent. */
  @Min(value = 1, message = "Table index must be 1 or greater")
  private Integer tableIndex;
}
