package com.example.datalake.csvguard.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationResultTest {

  @Test
  void emptyResultIsValidWithAllKindsZeroed() {
    ValidationResult result = ValidationResult.builder().filePath("a.csv").build();

    assertThat(result.isValid()).isTrue();
    assertThat(result.getErrorCount()).isZero();
    assertThat(result.getErrors()).isEmpty();
    assertThat(result.getSummary()).containsOnlyKeys(ErrorKind.values()).allSatisfy((kind, count) -> assertThat(count).isZero());
  }

  @Test
  void errorCountFollowsErrorsAndIsUnmodifiable() {
    List<ValidationError> errors = new ArrayList<>();
    errors.add(new ValidationError(2, "age", ErrorKind.TYPE, "bad", "x"));

    ValidationResult result = ValidationResult.builder()
        .filePath("a.csv")
        .totalRows(1)
        .errors(errors)
        .build();
    errors.clear();

    assertThat(result.isValid()).isFalse();
    assertThat(result.getErrorCount()).isEqualTo(1);
    assertThat(result.count(ErrorKind.TYPE)).isEqualTo(1);
    assertThatThrownBy(() -> result.getErrors().clear()).isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> result.getSummary().put(ErrorKind.FILE, 3)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void summaryIsCountedFromErrors() {
    ValidationResult result = ValidationResult.builder()
        .filePath("a.csv")
        .totalRows(3)
        .errors(List.of(
            new ValidationError(2, "age", ErrorKind.TYPE, "bad", "x"),
            new ValidationError(3, "age", ErrorKind.TYPE, "bad", "y"),
            new ValidationError(3, "email", ErrorKind.REQUIRED, "missing", null)))
        .build();

    assertThat(result.getSummary())
        .containsEntry(ErrorKind.TYPE, 2)
        .containsEntry(ErrorKind.REQUIRED, 1)
        .containsEntry(ErrorKind.FILE, 0);
    assertThat(result.getSummary().values().stream().mapToInt(Integer::intValue).sum())
        .isEqualTo(result.getErrorCount());
  }

  @Test
  void errorDefaultsColumnToEmptyString() {
    ValidationError error = new ValidationError(0, null, ErrorKind.FILE, "File is empty", null);

    assertThat(error.column()).isEmpty();
    assertThatThrownBy(() -> new ValidationError(-1, "", ErrorKind.FILE, "x", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
