package com.example.datalake.csvguard.validation;

/** Contract for the steps executed as part of the file validation pipeline. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  String name();

  /**
   * Applies the check and records findings on the context. Implementations report problems as
   * errors and call {@link ValidationContext#halt()} when later stages must not run; they do not
   * throw for file or data problems.
   */
  void validate(ValidationContext context);
}
