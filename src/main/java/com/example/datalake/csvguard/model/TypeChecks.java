package com.example.datalake.csvguard.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Parse checks backing {@link ColumnType}. All inputs are trimmed and non-empty. */
final class TypeChecks {

  private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
  private static final Pattern FLOAT = Pattern.compile(
      "[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
  private static final Pattern FLOAT_SPECIAL = Pattern.compile(
      "[+-]?(?:inf|infinity|nan)", Pattern.CASE_INSENSITIVE);
  private static final Set<String> BOOLEANS = Set.of("true", "false", "1", "0", "yes", "no");

  // Priority order matters: 01/02/2024 is read as January 2nd.
  private static final List<DateFormat> DATE_FORMATS = List.of(
      new DateFormat("uuuu-M-d", LocalDate::from),
      new DateFormat("uuuu-M-d H:m:s", LocalDateTime::from),
      new DateFormat("M/d/uuuu", LocalDate::from),
      new DateFormat("d/M/uuuu", LocalDate::from));

  private TypeChecks() {}

  static boolean isInteger(String value) {
    return INTEGER.matcher(value).matches();
  }

  static boolean isFloat(String value) {
    return FLOAT.matcher(value).matches() || FLOAT_SPECIAL.matcher(value).matches();
  }

  static boolean isBoolean(String value) {
    return BOOLEANS.contains(value.toLowerCase(Locale.ROOT));
  }

  static boolean isDate(String value) {
    for (DateFormat format : DATE_FORMATS) {
      if (format.parses(value)) {
        return true;
      }
    }
    return false;
  }

  private record DateFormat(DateTimeFormatter formatter, TemporalQuery<?> query) {

    DateFormat(String pattern, TemporalQuery<?> query) {
      this(DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT), query);
    }

    // Years start at 1.
    boolean parses(String value) {
      try {
        TemporalAccessor parsed = (TemporalAccessor) formatter.parse(value, query);
        return parsed.get(ChronoField.YEAR) >= 1;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  }
}
