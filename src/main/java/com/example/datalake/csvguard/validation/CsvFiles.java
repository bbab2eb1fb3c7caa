package com.example.datalake.csvguard.validation;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;

/** Opens validation sources. Decoding is strict: bad bytes fail the read instead of being replaced. */
final class CsvFiles {

  static final char BYTE_ORDER_MARK = '\uFEFF';

  private CsvFiles() {}

  static BufferedReader openStrict(Path path, Charset charset) throws IOException {
    CharsetDecoder decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
  }

  /** Quotes are special only at the start of a field; see {@link SpreadsheetCsvParser}. */
  static CSVReader openCsv(Path path, Charset charset, char delimiter) throws IOException {
    return new CSVReaderBuilder(openStrict(path, charset))
        .withCSVParser(new SpreadsheetCsvParser(delimiter))
        .build();
  }

  /** A physical blank line parses as one empty cell. */
  static boolean isBlankLine(String[] record) {
    return record.length == 0 || (record.length == 1 && record[0].isEmpty());
  }

  static String stripByteOrderMark(String cell) {
    if (cell != null && !cell.isEmpty() && cell.charAt(0) == BYTE_ORDER_MARK) {
      return cell.substring(1);
    }
    return cell;
  }

  static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }
}
