package com.example.datalake.csvguard.rules;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Looks up {@link NamedColumnValidator} beans by their name. */
@Slf4j
@Component
public class NamedValidatorRegistry {

  private final Map<String, NamedColumnValidator> validatorsByName;

  public NamedValidatorRegistry(List<NamedColumnValidator> validators) {
    Map<String, NamedColumnValidator> byName = new TreeMap<>();
    for (NamedColumnValidator validator : validators == null ? List.<NamedColumnValidator>of() : validators) {
      NamedColumnValidator previous = byName.putIfAbsent(validator.name(), validator);
      if (previous != null) {
        throw new IllegalStateException("Duplicate column validator name: " + validator.name());
      }
    }
    this.validatorsByName = Collections.unmodifiableMap(byName);
    log.info("Registered column validators: {}", validatorsByName.keySet());
  }

  public Optional<NamedColumnValidator> find(String name) {
    return Optional.ofNullable(name).map(validatorsByName::get);
  }

  public Set<String> names() {
    return validatorsByName.keySet();
  }
}
