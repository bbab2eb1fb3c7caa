package com.example.datalake.csvguard.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class NamedValidatorRegistryTest {

  @Test
  void findsBuiltInValidatorsByName() throws Exception {
    NamedValidatorRegistry registry = new NamedValidatorRegistry(
        List.of(new EmailColumnValidator(), new NonNegativeColumnValidator()));

    assertThat(registry.names()).containsExactly("email", "non-negative");
    assertThat(registry.find("email")).get().isInstanceOf(EmailColumnValidator.class);
    assertThat(registry.find("phone")).isEmpty();
    assertThat(registry.find(null)).isEmpty();
  }

  @Test
  void rejectsDuplicateNames() {
    assertThatThrownBy(() -> new NamedValidatorRegistry(
        List.of(new EmailColumnValidator(), new EmailColumnValidator())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Duplicate column validator name: email");
  }

  @Test
  void builtInsCheckValues() throws Exception {
    EmailColumnValidator email = new EmailColumnValidator();
    NonNegativeColumnValidator nonNegative = new NonNegativeColumnValidator();

    assertThat(email.test("ann@example.com")).isTrue();
    assertThat(email.test("ann@example")).isFalse();
    assertThat(email.test("ann example.com")).isFalse();
    assertThat(nonNegative.test("0")).isTrue();
    assertThat(nonNegative.test("12.5")).isTrue();
    assertThat(nonNegative.test("-1")).isFalse();
    assertThatThrownBy(() -> nonNegative.test("abc")).isInstanceOf(NumberFormatException.class);
  }
}
