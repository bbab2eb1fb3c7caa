package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.CsvSchema;
import com.example.datalake.csvguard.model.ErrorKind;
import com.example.datalake.csvguard.model.ValidationOptions;
import com.example.datalake.csvguard.model.ValidationResult;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link Validator} beans and executes them in stage order against a
 * fresh {@link ValidationContext}. File and data problems never escape as exceptions: they are
 * always part of the returned {@link ValidationResult}.
 */
@Slf4j
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  /** Pipeline with the four built-in stages, for use outside a Spring context. */
  public static ValidationService standard() {
    return new ValidationService(List.of(
        new FileAccessValidator(),
        new EncodingProbeValidator(),
        new HeaderStructureValidator(),
        new RowValidator()));
  }

  public ValidationResult validate(String filePath, CsvSchema schema) {
    return validate(filePath, schema, ValidationOptions.defaults());
  }

  public ValidationResult validate(String filePath, CsvSchema schema, ValidationOptions options) {
    ValidationContext context = new ValidationContext(filePath, schema, options);
    for (Validator validator : orderedValidators) {
      log.debug("[{}] {}", validator.name(), filePath);
      try {
        validator.validate(context);
      } catch (RuntimeException e) {
        log.warn("[{}] unexpected failure validating {}", validator.name(), filePath, e);
        context.fail(ErrorKind.FILE, "Unexpected error during validation: " + CsvFiles.describe(e));
      }
      if (context.isHalted()) {
        break;
      }
    }

    ValidationResult result = context.toResult();
    log.info("Validated {}: valid={}, rows={}, validatedRows={}, errors={}",
        filePath, result.isValid(), result.getTotalRows(), result.getRowsValidated(), result.getErrorCount());
    return result;
  }
}
