package com.example.datalake.csvguard.model;

/**
 * Caller supplied semantic check for a single cell. Only invoked for non-empty values that
 * already passed the type check. Throwing is allowed: the pipeline records the failure as a
 * {@link ErrorKind#CUSTOM} error instead of propagating it.
 */
@FunctionalInterface
public interface CustomValidator {

  boolean test(String value) throws Exception;
}
