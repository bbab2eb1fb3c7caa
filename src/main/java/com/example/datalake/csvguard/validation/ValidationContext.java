package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.CsvSchema;
import com.example.datalake.csvguard.model.ErrorKind;
import com.example.datalake.csvguard.model.ValidationError;
import com.example.datalake.csvguard.model.ValidationOptions;
import com.example.datalake.csvguard.model.ValidationResult;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Carries the request and the accumulated findings through the validation stages. Owned by a
 * single call; errors are only appended and counters only incremented. Stages publish what later
 * stages need (resolved path, charset, header positions) through the setters.
 */
public class ValidationContext {

  private final String filePath;
  private final CsvSchema schema;
  private final ValidationOptions options;

  private final List<ValidationError> errors = new ArrayList<>();
  private final Map<ErrorKind, Integer> summary = new EnumMap<>(ErrorKind.class);
  private int totalRows;
  private int rowsValidated;
  private boolean halted;

  private Path path;
  private Charset charset;
  private Map<String, Integer> headerIndex = Map.of();

  public ValidationContext(String filePath, CsvSchema schema, ValidationOptions options) {
    this.filePath = Objects.requireNonNull(filePath, "filePath");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.options = Objects.requireNonNull(options, "options");
    for (ErrorKind kind : ErrorKind.values()) {
      summary.put(kind, 0);
    }
  }

  public String getFilePath() {
    return filePath;
  }

  public CsvSchema getSchema() {
    return schema;
  }

  public ValidationOptions getOptions() {
    return options;
  }

  public Path getPath() {
    return path;
  }

  public void setPath(Path path) {
    this.path = path;
  }

  public Charset getCharset() {
    return charset;
  }

  public void setCharset(Charset charset) {
    this.charset = charset;
  }

  /** Column name to cell position, as read from the header row. */
  public Map<String, Integer> getHeaderIndex() {
    return headerIndex;
  }

  public void setHeaderIndex(Map<String, Integer> headerIndex) {
    this.headerIndex = Collections.unmodifiableMap(headerIndex);
  }

  /** Appends an error and bumps the matching counters. */
  public void addError(int line, String column, ErrorKind kind, String message, String value) {
    errors.add(new ValidationError(line, column, kind, message, value));
    summary.merge(kind, 1, Integer::sum);
  }

  /** Records a file level error (line 0, no column) and halts the pipeline. */
  public void fail(ErrorKind kind, String message) {
    errors.add(ValidationError.fileLevel(kind, message));
    summary.merge(kind, 1, Integer::sum);
    halt();
  }

  public int getErrorCount() {
    return errors.size();
  }

  public int count(ErrorKind kind) {
    return summary.get(kind);
  }

  public List<ValidationError> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  /** True once {@code maxErrors} is set and the number of collected errors has reached it. */
  public boolean isCapReached() {
    return options.hasErrorCap() && errors.size() >= options.getMaxErrors();
  }

  public void incrementTotalRows() {
    totalRows++;
  }

  public void incrementRowsValidated() {
    rowsValidated++;
  }

  public int getTotalRows() {
    return totalRows;
  }

  public int getRowsValidated() {
    return rowsValidated;
  }

  /** Stops the pipeline after the current stage returns. */
  public void halt() {
    this.halted = true;
  }

  public boolean isHalted() {
    return halted;
  }

  public ValidationResult toResult() {
    return ValidationResult.builder()
        .filePath(filePath)
        .totalRows(totalRows)
        .rowsValidated(rowsValidated)
        .errors(errors)
        .build();
  }
}
