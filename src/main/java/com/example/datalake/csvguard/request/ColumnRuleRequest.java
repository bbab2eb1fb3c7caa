package com.example.datalake.csvguard.request;

/**
 * JSON form of a column rule. {@code type} is resolved with
 * {@link com.example.datalake.csvguard.model.ColumnType#fromName(String)} and defaults to String;
 * {@code validator} names a registered column validator.
 */
public record ColumnRuleRequest(String type, Boolean required, Boolean nullable, String validator) {}
