package com.example.datalake.csvguard.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.LinkedHashMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class ValidationRequest {
  @NotBlank private String filePath;

  private String encoding;
  private String delimiter;
  @Positive private Integer maxErrors;

  // column order in the payload is the schema order
  @NotEmpty private LinkedHashMap<String, ColumnRuleRequest> columns;
}
