package com.example.datalake.csvguard.validation;

import com.opencsv.AbstractCSVParser;
import com.opencsv.ICSVParser;
import com.opencsv.enums.CSVReaderNullFieldIndicator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits records the way spreadsheet exports are written. A quote opens a quoted section only as
 * the first character of a field; anywhere else it is an ordinary character, so {@code ab"c} is
 * read as is. Inside a quoted section a doubled quote stands for one quote and the section may
 * span lines. Text following the closing quote is appended to the field.
 */
final class SpreadsheetCsvParser extends AbstractCSVParser {

  private enum State { FIELD_START, UNQUOTED, QUOTED, QUOTE_IN_QUOTED }

  private final char delimiter;
  private final char quote;

  /** Text of a quoted field still open at the end of the previous line. */
  private StringBuilder openField;

  SpreadsheetCsvParser(char delimiter) {
    super(delimiter, ICSVParser.DEFAULT_QUOTE_CHARACTER, CSVReaderNullFieldIndicator.NEITHER);
    this.delimiter = delimiter;
    this.quote = ICSVParser.DEFAULT_QUOTE_CHARACTER;
  }

  @Override
  protected String[] parseLine(String nextLine, boolean multi) {
    List<String> fields = new ArrayList<>();
    StringBuilder field;
    State state;
    if (multi && openField != null) {
      field = openField.append('\n');
      state = State.QUOTED;
    } else {
      field = new StringBuilder();
      state = State.FIELD_START;
    }
    openField = null;

    for (int i = 0; i < nextLine.length(); i++) {
      char c = nextLine.charAt(i);
      if (state == State.QUOTED) {
        if (c == quote) {
          state = State.QUOTE_IN_QUOTED;
        } else {
          field.append(c);
        }
      } else if (c == delimiter) {
        fields.add(field.toString());
        field.setLength(0);
        state = State.FIELD_START;
      } else if (state == State.FIELD_START && c == quote) {
        state = State.QUOTED;
      } else if (state == State.QUOTE_IN_QUOTED && c == quote) {
        field.append(c);
        state = State.QUOTED;
      } else {
        field.append(c);
        state = State.UNQUOTED;
      }
    }

    if (state == State.QUOTED && multi) {
      openField = field;
    } else {
      fields.add(field.toString());
    }
    return fields.toArray(new String[0]);
  }

  @Override
  public boolean isPending() {
    return openField != null;
  }

  @Override
  public String getPendingText() {
    return openField == null ? "" : openField.toString();
  }

  // Messages come from the reader, not from this parser.
  public void setErrorLocale(Locale errorLocale) {
  }

  protected String convertToCsvValue(String value, boolean applyQuotesToAll) {
    String text = value == null ? "" : value;
    boolean needsQuotes = applyQuotesToAll
        || text.indexOf(delimiter) >= 0
        || text.indexOf(quote) >= 0
        || text.indexOf('\n') >= 0
        || text.indexOf('\r') >= 0;
    if (!needsQuotes) {
      return text;
    }
    String doubled = text.replace(String.valueOf(quote), String.valueOf(quote) + quote);
    return quote + doubled + quote;
  }
}
