package com.example.datalake.csvguard.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class SpreadsheetCsvParserTest {

  private final SpreadsheetCsvParser parser = new SpreadsheetCsvParser(',');

  @Test
  void quoteInsideUnquotedFieldIsLiteral() throws IOException {
    assertThat(parser.parseLineMulti("1,ab\"c,5' 10\""))
        .containsExactly("1", "ab\"c", "5' 10\"");
    assertThat(parser.isPending()).isFalse();
  }

  @Test
  void quotedFieldKeepsDelimitersAndDoubledQuotes() throws IOException {
    assertThat(parser.parseLineMulti("\"Smith, John\",\"O\"\"Brien\",\"\""))
        .containsExactly("Smith, John", "O\"Brien", "");
  }

  @Test
  void textAfterClosingQuoteIsAppended() throws IOException {
    assertThat(parser.parseLineMulti("\"ab\"c,d")).containsExactly("abc", "d");
  }

  @Test
  void trailingDelimiterYieldsEmptyLastField() throws IOException {
    assertThat(parser.parseLineMulti("a,")).containsExactly("a", "");
    assertThat(parser.parseLineMulti("")).containsExactly("");
  }

  @Test
  void openQuotedFieldContinuesOnNextLine() throws IOException {
    assertThat(parser.parseLineMulti("1,\"first")).containsExactly("1");
    assertThat(parser.isPending()).isTrue();
    assertThat(parser.getPendingText()).isEqualTo("first");

    assertThat(parser.parseLineMulti("second\",x")).containsExactly("first\nsecond", "x");
    assertThat(parser.isPending()).isFalse();
  }

  @Test
  void honoursConfiguredDelimiter() throws IOException {
    SpreadsheetCsvParser semicolons = new SpreadsheetCsvParser(';');

    assertThat(semicolons.parseLineMulti("a,b;\"c;d\"")).containsExactly("a,b", "c;d");
  }
}
