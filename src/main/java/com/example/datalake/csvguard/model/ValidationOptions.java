package com.example.datalake.csvguard.model;

import java.nio.charset.StandardCharsets;
import lombok.Builder;
import lombok.Value;

/**
 * Per call reading options. {@code encoding} is kept as the caller supplied name so that an
 * unknown charset surfaces as a file error in the result instead of an exception.
 */
@Value
public class ValidationOptions {

  public static final String DEFAULT_ENCODING = StandardCharsets.UTF_8.name();
  public static final char DEFAULT_DELIMITER = ',';

  String encoding;
  char delimiter;
  /** Cap on collected errors; {@code null} means unlimited. */
  Integer maxErrors;

  @Builder(toBuilder = true)
  private ValidationOptions(String encoding, char delimiter, Integer maxErrors) {
    if (encoding == null || encoding.isBlank()) {
      throw new IllegalArgumentException("encoding must not be blank");
    }
    if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
      throw new IllegalArgumentException("delimiter must not be a quote or line break");
    }
    if (maxErrors != null && maxErrors <= 0) {
      throw new IllegalArgumentException("maxErrors must be positive");
    }
    this.encoding = encoding;
    this.delimiter = delimiter;
    this.maxErrors = maxErrors;
  }

  public static ValidationOptions defaults() {
    return builder().build();
  }

  public boolean hasErrorCap() {
    return maxErrors != null;
  }

  public static class ValidationOptionsBuilder {
    private String encoding = DEFAULT_ENCODING;
    private char delimiter = DEFAULT_DELIMITER;
  }
}
