package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.ErrorKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Confirms the target exists, is a regular file and is not empty, in that order. */
@Slf4j
@Component
public class FileAccessValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.ACCESS;
  }

  @Override
  public String name() {
    return "validator:file-access";
  }

  @Override
  public void validate(ValidationContext context) {
    String filePath = context.getFilePath();
    try {
      Path path = Path.of(filePath);
      if (!Files.exists(path)) {
        context.fail(ErrorKind.FILE, "File not found: " + filePath);
        return;
      }
      if (!Files.isRegularFile(path)) {
        context.fail(ErrorKind.FILE, "Path is not a file: " + filePath);
        return;
      }
      if (Files.size(path) == 0) {
        context.fail(ErrorKind.FILE, "File is empty");
        return;
      }
      context.setPath(path);
    } catch (InvalidPathException | IOException | SecurityException e) {
      log.debug("[{}] cannot access {}", name(), filePath, e);
      context.fail(ErrorKind.FILE, "File access error: " + CsvFiles.describe(e));
    }
  }
}
