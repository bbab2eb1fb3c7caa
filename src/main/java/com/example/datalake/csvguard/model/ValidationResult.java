package com.example.datalake.csvguard.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Finished outcome of one validation run. Immutable: the summary is derived from the errors, always
 * holds all five {@link ErrorKind}s and sums to {@code errorCount == errors.size()}.
 */
@Value
public class ValidationResult {

  boolean valid;
  String filePath;
  int totalRows;
  int rowsValidated;
  int errorCount;
  Map<ErrorKind, Integer> summary;
  List<ValidationError> errors;

  @Builder
  private ValidationResult(
      String filePath,
      int totalRows,
      int rowsValidated,
      List<ValidationError> errors) {
    List<ValidationError> safeErrors = errors == null ? List.of() : List.copyOf(errors);
    Map<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
    for (ErrorKind kind : ErrorKind.values()) {
      counts.put(kind, 0);
    }
    for (ValidationError error : safeErrors) {
      counts.merge(error.kind(), 1, Integer::sum);
    }
    this.filePath = filePath;
    this.totalRows = totalRows;
    this.rowsValidated = rowsValidated;
    this.errors = safeErrors;
    this.errorCount = safeErrors.size();
    this.summary = Collections.unmodifiableMap(counts);
    this.valid = safeErrors.isEmpty();
  }

  public int count(ErrorKind kind) {
    return summary.getOrDefault(kind, 0);
  }
}
