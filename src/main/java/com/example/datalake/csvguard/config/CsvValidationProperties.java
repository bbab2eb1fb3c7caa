package com.example.datalake.csvguard.config;

import com.example.datalake.csvguard.model.ValidationOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Defaults applied when a request leaves encoding, delimiter or cap unset. */
@ConfigurationProperties(prefix = "csv-validation")
@Validated
public class CsvValidationProperties {

  @NotBlank
  private String encoding = ValidationOptions.DEFAULT_ENCODING;
  private char delimiter = ValidationOptions.DEFAULT_DELIMITER;
  @Positive
  private Integer maxErrors;
  @Valid
  private final Report report = new Report();

  public String getEncoding() {
    return encoding;
  }

  public void setEncoding(String encoding) {
    this.encoding = encoding;
  }

  public char getDelimiter() {
    return delimiter;
  }

  public void setDelimiter(char delimiter) {
    this.delimiter = delimiter;
  }

  public Integer getMaxErrors() {
    return maxErrors;
  }

  public void setMaxErrors(Integer maxErrors) {
    this.maxErrors = maxErrors;
  }

  public Report getReport() {
    return report;
  }

  public ValidationOptions toOptions() {
    return ValidationOptions.builder()
        .encoding(encoding)
        .delimiter(delimiter)
        .maxErrors(maxErrors)
        .build();
  }

  public static final class Report {
    private boolean verbose;
    @Min(0)
    private int maxDetailedErrors = 100;

    public boolean isVerbose() {
      return verbose;
    }

    public void setVerbose(boolean verbose) {
      this.verbose = verbose;
    }

    public int getMaxDetailedErrors() {
      return maxDetailedErrors;
    }

    public void setMaxDetailedErrors(int maxDetailedErrors) {
      this.maxDetailedErrors = maxDetailedErrors;
    }
  }
}
