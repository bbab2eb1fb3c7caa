package com.example.datalake.csvguard.model;

import java.util.Objects;

/**
 * A single violation found while validating a file.
 *
 * <p>{@code line} is 0 for file level problems, 1 for the header and 2 or more for data rows.
 * {@code column} is empty when the error is not tied to a column. {@code value} carries the raw
 * offending cell text for type and custom errors and is {@code null} otherwise.
 */
public record ValidationError(int line, String column, ErrorKind kind, String message, String value) {

  public ValidationError {
    if (line < 0) {
      throw new IllegalArgumentException("line must not be negative");
    }
    column = Objects.requireNonNullElse(column, "");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static ValidationError fileLevel(ErrorKind kind, String message) {
    return new ValidationError(0, "", kind, message, null);
  }
}
