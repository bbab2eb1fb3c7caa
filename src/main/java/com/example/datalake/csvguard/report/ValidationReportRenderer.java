package com.example.datalake.csvguard.report;

import com.example.datalake.csvguard.config.CsvValidationProperties;
import com.example.datalake.csvguard.model.ErrorKind;
import com.example.datalake.csvguard.model.ValidationError;
import com.example.datalake.csvguard.model.ValidationResult;
import java.io.PrintStream;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders a finished {@link ValidationResult} as a plain text report. Read only: the result is
 * never modified.
 */
@Component
public class ValidationReportRenderer {

  private static final int DEFAULT_MAX_DETAILED_ERRORS = 100;
  private static final String RULE = "=".repeat(70);
  private static final String SECTION_RULE = "-".repeat(70);

  private final int maxDetailedErrors;

  public ValidationReportRenderer() {
    this(DEFAULT_MAX_DETAILED_ERRORS);
  }

  @Autowired
  public ValidationReportRenderer(CsvValidationProperties properties) {
    this(properties.getReport().getMaxDetailedErrors());
  }

  public ValidationReportRenderer(int maxDetailedErrors) {
    if (maxDetailedErrors < 0) {
      throw new IllegalArgumentException("maxDetailedErrors must not be negative");
    }
    this.maxDetailedErrors = maxDetailedErrors;
  }

  public void print(ValidationResult result, boolean verbose, PrintStream out) {
    out.print(render(result, verbose));
    out.flush();
  }

  public String render(ValidationResult result, boolean verbose) {
    StringBuilder sb = new StringBuilder();
    sb.append('\n').append(RULE).append('\n');
    sb.append("CSV VALIDATION REPORT\n");
    sb.append(RULE).append('\n');
    sb.append("File: ").append(result.getFilePath()).append('\n');
    sb.append("Status: ").append(result.isValid() ? "✓ VALID" : "✗ INVALID").append('\n');
    sb.append("Total Rows: ").append(result.getTotalRows()).append('\n');
    sb.append("Rows Validated: ").append(result.getRowsValidated()).append('\n');
    sb.append("Total Errors: ").append(result.getErrorCount()).append('\n');

    if (result.getErrorCount() > 0) {
      appendSummary(sb, result);
      if (verbose) {
        appendDetails(sb, result.getErrors());
      }
    }

    sb.append('\n').append(RULE).append("\n\n");
    return sb.toString();
  }

  private static void appendSummary(StringBuilder sb, ValidationResult result) {
    sb.append('\n').append(SECTION_RULE).append('\n');
    sb.append("ERROR SUMMARY\n");
    sb.append(SECTION_RULE).append('\n');
    for (ErrorKind kind : ErrorKind.values()) {
      int count = result.count(kind);
      if (count > 0) {
        sb.append(kind.summaryLabel()).append(": ").append(count).append('\n');
      }
    }
  }

  private void appendDetails(StringBuilder sb, List<ValidationError> errors) {
    sb.append('\n').append(SECTION_RULE).append('\n');
    sb.append("DETAILED ERRORS\n");
    sb.append(SECTION_RULE).append('\n');

    int shown = Math.min(errors.size(), maxDetailedErrors);
    for (int i = 0; i < shown; i++) {
      ValidationError error = errors.get(i);
      sb.append('\n').append(i + 1).append(". Line ").append(error.line())
          .append(", Column '").append(error.column()).append("'\n");
      sb.append("   Type: ").append(error.kind().code()).append('\n');
      sb.append("   Message: ").append(error.message()).append('\n');
      if (error.value() != null) {
        sb.append("   Value: ").append(error.value()).append('\n');
      }
    }

    if (errors.size() > shown) {
      sb.append("\n... and ").append(errors.size() - shown).append(" more errors\n");
    }
  }
}
