package com.example.datalake.csvguard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered mapping of column name to {@link ColumnRule}. Declaration order drives row iteration
 * and therefore the order in which errors are reported.
 */
public final class CsvSchema {

  private final Map<String, ColumnRule> columns;

  private CsvSchema(Map<String, ColumnRule> columns) {
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, ColumnRule> columns() {
    return columns;
  }

  public Set<String> columnNames() {
    return columns.keySet();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CsvSchema other)) return false;
    return columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "CsvSchema" + columns.keySet();
  }

  public static final class Builder {
    private final Map<String, ColumnRule> columns = new LinkedHashMap<>();

    private Builder() {}

    public Builder column(String name, ColumnRule rule) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(rule, "rule");
      if (columns.putIfAbsent(name, rule) != null) {
        throw new IllegalArgumentException("Duplicate column in schema: " + name);
      }
      return this;
    }

    public Builder column(String name, ColumnType type) {
      return column(name, ColumnRule.of(type));
    }

    public CsvSchema build() {
      return new CsvSchema(columns);
    }
  }
}
