package com.example.datalake.csvguard.validation;

import com.example.datalake.csvguard.model.ErrorKind;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the first line under the requested encoding. Failing here keeps a wrongly decoded file
 * from turning into a flood of per cell type errors.
 */
@Slf4j
@Component
public class EncodingProbeValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.DECODE;
  }

  @Override
  public String name() {
    return "validator:encoding-probe";
  }

  @Override
  public void validate(ValidationContext context) {
    String encoding = context.getOptions().getEncoding();
    Charset charset;
    try {
      charset = Charset.forName(encoding);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      context.fail(ErrorKind.FILE, "Error opening file: Unsupported encoding '" + encoding + "'");
      return;
    }

    try (BufferedReader reader = CsvFiles.openStrict(context.getPath(), charset)) {
      reader.readLine();
      context.setCharset(charset);
    } catch (CharacterCodingException e) {
      log.debug("[{}] {} does not decode as {}", name(), context.getFilePath(), encoding);
      context.fail(ErrorKind.FILE, encodingError(encoding, e));
    } catch (IOException e) {
      context.fail(ErrorKind.FILE, "Error opening file: " + CsvFiles.describe(e));
    }
  }

  static String encodingError(String encoding, CharacterCodingException e) {
    return "Encoding error: Unable to read file with " + encoding + " encoding. " + CsvFiles.describe(e);
  }
}
