package com.example.datalake.csvguard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/** Failure categories recorded in a {@link ValidationResult}. */
public enum ErrorKind {
  /** The source file cannot be accessed, opened or decoded. */
  @JsonProperty("file")
  FILE,
  /** Header and schema disagree, or the CSV syntax is broken. */
  @JsonProperty("structural")
  STRUCTURAL,
  /** A cell value cannot be parsed as the declared column type. */
  @JsonProperty("type")
  TYPE,
  /** A non-nullable cell is empty. */
  @JsonProperty("required")
  REQUIRED,
  /** A custom validator rejected the value or failed while checking it. */
  @JsonProperty("custom")
  CUSTOM;

  /** Lower case code used in JSON payloads and reports. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Heading used in the report summary, e.g. {@code Structural Errors}. */
  public String summaryLabel() {
    String code = code();
    return Character.toUpperCase(code.charAt(0)) + code.substring(1) + " Errors";
  }
}
