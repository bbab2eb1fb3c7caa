package com.example.datalake.csvguard.model;

import lombok.Builder;
import lombok.Value;

/**
 * Constraints for one schema column. {@code required} and {@code nullable} are both optional:
 * an explicit {@code required} wins, otherwise {@code required = !nullable}, and a rule with
 * neither is required.
 */
@Value
@Builder(toBuilder = true)
public class ColumnRule {

  @Builder.Default ColumnType type = ColumnType.STRING;
  Boolean required;
  Boolean nullable;
  CustomValidator validator;

  public static ColumnRule of(ColumnType type) {
    return builder().type(type).build();
  }

  public static ColumnRule optional(ColumnType type) {
    return builder().type(type).nullable(true).build();
  }

  /** Effective required flag after resolving {@code required} against {@code nullable}. */
  public boolean isRequired() {
    if (required != null) {
      return required;
    }
    if (nullable != null) {
      return !nullable;
    }
    return true;
  }

  public boolean hasValidator() {
    return validator != null;
  }
}
