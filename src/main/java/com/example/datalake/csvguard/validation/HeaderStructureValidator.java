package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.ErrorKind;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses the header row and reconciles it with the schema. Every schema column missing from the
 * header is reported; columns the schema does not mention are ignored.
 */
@Slf4j
@Component
public class HeaderStructureValidator implements Validator {

  static final int HEADER_LINE = 1;

  @Override
  public ValidationStage stage() {
    return ValidationStage.STRUCTURE;
  }

  @Override
  public String name() {
    return "validator:header-structure";
  }

  @Override
  public void validate(ValidationContext context) {
    String[] header;
    try (CSVReader reader = CsvFiles.openCsv(
        context.getPath(), context.getCharset(), context.getOptions().getDelimiter())) {
      header = reader.readNext();
    } catch (CsvValidationException | CsvMalformedLineException e) {
      context.fail(ErrorKind.STRUCTURAL, "CSV parsing error: " + CsvFiles.describe(e));
      return;
    } catch (CharacterCodingException e) {
      context.fail(ErrorKind.FILE,
          EncodingProbeValidator.encodingError(context.getOptions().getEncoding(), e));
      return;
    } catch (IOException e) {
      context.fail(ErrorKind.FILE, "Error opening file: " + CsvFiles.describe(e));
      return;
    }

    // A blank header row is still a header; its missing columns are reported below.
    if (header == null) {
      context.addError(HEADER_LINE, "", ErrorKind.STRUCTURAL, "No headers found in CSV file", null);
      context.halt();
      return;
    }

    Map<String, Integer> index = indexHeader(header);
    List<String> missing = context.getSchema().columnNames().stream()
        .filter(column -> !index.containsKey(column))
        .toList();
    for (String column : missing) {
      context.addError(HEADER_LINE, column, ErrorKind.STRUCTURAL,
          "Required column '" + column + "' not found in CSV headers", null);
    }
    if (!missing.isEmpty()) {
      context.halt();
      return;
    }

    if (log.isDebugEnabled()) {
      List<String> extra = index.keySet().stream()
          .filter(column -> !context.getSchema().columnNames().contains(column))
          .toList();
      if (!extra.isEmpty()) {
        log.debug("[{}] ignoring columns not in schema: {}", name(), extra);
      }
    }
    context.setHeaderIndex(index);
  }

  private static Map<String, Integer> indexHeader(String[] header) {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < header.length; i++) {
      String name = i == 0 ? CsvFiles.stripByteOrderMark(header[i]) : header[i];
      index.putIfAbsent(name, i);
    }
    return index;
  }
}
