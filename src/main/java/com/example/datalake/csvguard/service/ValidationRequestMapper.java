package com.example.datalake.csvguard.service;

import com.example.datalake.csvguard.config.CsvValidationProperties;
import com.example.datalake.csvguard.model.ColumnRule;
import com.example.datalake.csvguard.model.ColumnType;
import com.example.datalake.csvguard.model.CsvSchema;
import com.example.datalake.csvguard.model.CustomValidator;
import com.example.datalake.csvguard.model.ValidationOptions;
import com.example.datalake.csvguard.request.ColumnRuleRequest;
import com.example.datalake.csvguard.request.ValidationRequest;
import com.example.datalake.csvguard.rules.NamedValidatorRegistry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/** Turns the HTTP payload into a {@link CsvSchema} and {@link ValidationOptions}. */
@Component
@RequiredArgsConstructor
public class ValidationRequestMapper {

  private final CsvValidationProperties properties;
  private final NamedValidatorRegistry validatorRegistry;

  public CsvSchema toSchema(ValidationRequest request) {
    Map<String, ColumnRuleRequest> columns = request.getColumns();
    if (columns == null || columns.isEmpty()) {
      throw badRequest("Schema must declare at least one column");
    }

    CsvSchema.Builder schema = CsvSchema.builder();
    columns.forEach((name, rule) -> {
      if (name == null || name.isEmpty()) {
        throw badRequest("Column names must not be empty");
      }
      schema.column(name, toRule(name, rule));
    });
    return schema.build();
  }

  public ValidationOptions toOptions(ValidationRequest request) {
    ValidationOptions defaults = properties.toOptions();
    ValidationOptions.ValidationOptionsBuilder options = defaults.toBuilder();

    if (request.getEncoding() != null && !request.getEncoding().isBlank()) {
      options.encoding(request.getEncoding().trim());
    }
    String delimiter = request.getDelimiter();
    if (delimiter != null && !delimiter.isEmpty()) {
      if (delimiter.length() != 1) {
        throw badRequest("Delimiter must be a single character");
      }
      options.delimiter(delimiter.charAt(0));
    }
    if (request.getMaxErrors() != null) {
      options.maxErrors(request.getMaxErrors());
    }

    try {
      return options.build();
    } catch (IllegalArgumentException e) {
      throw badRequest(e.getMessage());
    }
  }

  private ColumnRule toRule(String column, ColumnRuleRequest rule) {
    if (rule == null) {
      return ColumnRule.of(ColumnType.STRING);
    }

    ColumnType type;
    try {
      type = rule.type() == null ? ColumnType.STRING : ColumnType.fromName(rule.type());
    } catch (IllegalArgumentException e) {
      throw badRequest("Column '" + column + "': " + e.getMessage());
    }

    CustomValidator validator = null;
    if (rule.validator() != null && !rule.validator().isBlank()) {
      validator = validatorRegistry.find(rule.validator().trim())
          .orElseThrow(() -> badRequest("Column '" + column + "': unknown validator '"
              + rule.validator() + "', expected one of " + validatorRegistry.names()));
    }

    return ColumnRule.builder()
        .type(type)
        .required(rule.required())
        .nullable(rule.nullable())
        .validator(validator)
        .build();
  }

  private static ResponseStatusException badRequest(String reason) {
    return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
  }
}
