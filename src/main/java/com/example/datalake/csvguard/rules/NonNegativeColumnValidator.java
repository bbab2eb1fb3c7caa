package com.example.datalake.csvguard.rules;

import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Accepts numbers greater than or equal to zero. Non-numeric input throws
 * {@link NumberFormatException}, which the pipeline reports as a validator error.
 */
@Component
public class NonNegativeColumnValidator implements NamedColumnValidator {

  @Override
  public String name() {
    return "non-negative";
  }

  @Override
  public boolean test(String value) {
    return new BigDecimal(value).signum() >= 0;
  }
}
