package com.example.datalake.csvguard.rules;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Accepts values shaped like {@code local@domain.tld}. */
@Component
public class EmailColumnValidator implements NamedColumnValidator {

  private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");

  @Override
  public String name() {
    return "email";
  }

  @Override
  public boolean test(String value) {
    return EMAIL.matcher(value).matches();
  }
}
