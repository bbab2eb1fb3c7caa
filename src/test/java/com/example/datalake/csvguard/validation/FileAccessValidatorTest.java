package com.example.datalake.csvguard.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.csvguard.model.ColumnType;
import com.example.datalake.csvguard.model.CsvSchema;
import com.example.datalake.csvguard.model.ErrorKind;
import com.example.datalake.csvguard.model.ValidationOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileAccessValidatorTest {

  private static final CsvSchema SCHEMA = CsvSchema.builder().column("id", ColumnType.INTEGER).build();

  private final FileAccessValidator validator = new FileAccessValidator();

  @TempDir
  Path tempDir;

  @Test
  void resolvesPathForReadableFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("a.csv"), "id\n1\n");
    ValidationContext context = new ValidationContext(file.toString(), SCHEMA, ValidationOptions.defaults());

    validator.validate(context);

    assertThat(context.isHalted()).isFalse();
    assertThat(context.getErrorCount()).isZero();
    assertThat(context.getPath()).isEqualTo(file);
  }

  @Test
  void haltsOnMissingFile() {
    ValidationContext context = new ValidationContext(
        tempDir.resolve("missing.csv").toString(), SCHEMA, ValidationOptions.defaults());

    validator.validate(context);

    assertThat(context.isHalted()).isTrue();
    assertThat(context.count(ErrorKind.FILE)).isEqualTo(1);
    assertThat(context.getPath()).isNull();
  }

  @Test
  void reportsUnrepresentablePathAsAccessError() {
    ValidationContext context = new ValidationContext("bad\u0000name.csv", SCHEMA, ValidationOptions.defaults());

    validator.validate(context);

    assertThat(context.isHalted()).isTrue();
    assertThat(context.getErrors()).singleElement()
        .satisfies(error -> assertThat(error.message()).startsWith("File access error: "));
  }
}
