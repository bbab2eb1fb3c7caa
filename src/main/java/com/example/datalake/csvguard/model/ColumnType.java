package com.example.datalake.csvguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/** Closed set of column types, each bound to the check that accepts its textual form. */
public enum ColumnType {
  STRING("String", value -> true),
  INTEGER("Integer", TypeChecks::isInteger),
  FLOAT("Float", TypeChecks::isFloat),
  BOOLEAN("Boolean", TypeChecks::isBoolean),
  DATE("Date", TypeChecks::isDate);

  private static final Map<String, ColumnType> ALIASES = Map.of(
      "str", STRING,
      "int", INTEGER,
      "bool", BOOLEAN,
      "datetime", DATE);

  private final String displayName;
  private final Predicate<String> check;

  ColumnType(String displayName, Predicate<String> check) {
    this.displayName = displayName;
    this.check = check;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  /** Tests a trimmed, non-empty cell value. */
  public boolean accepts(String value) {
    return check.test(value);
  }

  /**
   * Resolves a type by name, case-insensitively. Accepts the enum names and the short aliases
   * {@code str}, {@code int}, {@code bool} and {@code datetime}.
   */
  @JsonCreator
  public static ColumnType fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Column type must not be blank");
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    ColumnType alias = ALIASES.get(key);
    if (alias != null) {
      return alias;
    }
    for (ColumnType type : values()) {
      if (type.name().equalsIgnoreCase(key)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown column type: " + name);
  }
}
