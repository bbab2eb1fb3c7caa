package com.example.datalake.csvguard.validation;

/** Identifies where in the pipeline a validator is executed. Declaration order is run order. */
public enum ValidationStage {
  /** The path exists, is a regular file and is not empty. */
  ACCESS,
  /** The file decodes under the requested encoding. */
  DECODE,
  /** The header row covers every schema column. */
  STRUCTURE,
  /** Per row, per column checks. */
  ROWS
}
