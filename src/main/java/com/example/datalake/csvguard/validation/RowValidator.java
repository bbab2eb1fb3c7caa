package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.ColumnRule;
import com.example.datalake.csvguard.model.ErrorKind;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Walks the data rows and applies each column rule. Per column the checks short-circuit in the
 * order required, type, custom. Stops reading rows once the error cap is reached.
 */
@Slf4j
@Component
public class RowValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.ROWS;
  }

  @Override
  public String name() {
    return "validator:rows";
  }

  @Override
  public void validate(ValidationContext context) {
    try (CSVReader reader = CsvFiles.openCsv(
        context.getPath(), context.getCharset(), context.getOptions().getDelimiter())) {
      if (reader.readNext() == null) {
        return;
      }
      while (!context.isCapReached()) {
        int line = Math.toIntExact(reader.getLinesRead() + 1);
        String[] record = reader.readNext();
        if (record == null) {
          break;
        }
        if (CsvFiles.isBlankLine(record)) {
          continue;
        }
        validateRow(context, line, record);
      }
    } catch (CsvValidationException | CsvMalformedLineException e) {
      context.fail(ErrorKind.STRUCTURAL, "CSV parsing error: " + CsvFiles.describe(e));
    } catch (CharacterCodingException e) {
      context.fail(ErrorKind.FILE,
          EncodingProbeValidator.encodingError(context.getOptions().getEncoding(), e));
    } catch (IOException e) {
      log.warn("[{}] read failure in {} after {} rows", name(), context.getFilePath(), context.getTotalRows(), e);
      context.fail(ErrorKind.FILE, "Unexpected error during validation: " + CsvFiles.describe(e));
    }
  }

  private void validateRow(ValidationContext context, int line, String[] record) {
    context.incrementTotalRows();
    int errorsBefore = context.getErrorCount();
    Map<String, Integer> headerIndex = context.getHeaderIndex();

    for (Map.Entry<String, ColumnRule> column : context.getSchema().columns().entrySet()) {
      String value = cell(record, headerIndex.get(column.getKey())).strip();
      checkCell(context, line, column.getKey(), column.getValue(), value);
      if (context.isCapReached()) {
        break;
      }
    }

    if (context.getErrorCount() == errorsBefore) {
      context.incrementRowsValidated();
    }
  }

  private void checkCell(ValidationContext context, int line, String column, ColumnRule rule, String value) {
    if (value.isEmpty()) {
      if (rule.isRequired()) {
        context.addError(line, column, ErrorKind.REQUIRED,
            "Required field '" + column + "' is empty or missing", null);
      }
      return;
    }

    if (!rule.getType().accepts(value)) {
      context.addError(line, column, ErrorKind.TYPE,
          "Invalid type for '" + column + "'. Expected " + rule.getType().displayName()
              + ", got '" + value + "'",
          value);
      return;
    }

    if (!rule.hasValidator()) {
      return;
    }
    try {
      if (!rule.getValidator().test(value)) {
        context.addError(line, column, ErrorKind.CUSTOM,
            "Custom validation failed for '" + column + "' with value '" + value + "'", value);
      }
    } catch (Exception e) {
      context.addError(line, column, ErrorKind.CUSTOM,
          "Custom validator error for '" + column + "': " + CsvFiles.describe(e), value);
    }
  }

  private static String cell(String[] record, Integer position) {
    if (position == null || position >= record.length || record[position] == null) {
      return "";
    }
    return record[position];
  }
}
