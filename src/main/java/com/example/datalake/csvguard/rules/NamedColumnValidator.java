package com.example.datalake.csvguard.rules;

import com.example.datalake.csvguard.model.CustomValidator;

/** A {@link CustomValidator} that HTTP callers can reference by name from a schema. */
public interface NamedColumnValidator extends CustomValidator {

  String name();
}
