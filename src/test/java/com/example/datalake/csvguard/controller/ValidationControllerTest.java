package com.example.datalake.csvguard.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.csvguard.config.CsvValidationProperties;
import com.example.datalake.csvguard.model.ErrorKind;
import com.example.datalake.csvguard.model.ValidationError;
import com.example.datalake.csvguard.model.ValidationResult;
import com.example.datalake.csvguard.report.ValidationReportRenderer;
import com.example.datalake.csvguard.request.ColumnRuleRequest;
import com.example.datalake.csvguard.request.ValidationRequest;
import com.example.datalake.csvguard.rules.EmailColumnValidator;
import com.example.datalake.csvguard.rules.NamedValidatorRegistry;
import com.example.datalake.csvguard.rules.NonNegativeColumnValidator;
import com.example.datalake.csvguard.service.ValidationRequestMapper;
import com.example.datalake.csvguard.validation.ValidationService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

class ValidationControllerTest {

  private final CsvValidationProperties properties = new CsvValidationProperties();
  private final ValidationRequestMapper mapper = new ValidationRequestMapper(properties,
      new NamedValidatorRegistry(List.of(new EmailColumnValidator(), new NonNegativeColumnValidator())));

  @TempDir
  Path tempDir;

  @Test
  void validateReturnsResultBody() throws IOException {
    Path file = Files.writeString(tempDir.resolve("users.csv"), """
        id,email,balance
        1,ann@example.com,10
        2,bob,-5
        """);
    ValidationController controller = newController(ValidationService.standard());

    ResponseEntity<ValidationResult> response = controller.validate(request(file.toString())).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    ValidationResult body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.isValid()).isFalse();
    assertThat(body.getTotalRows()).isEqualTo(2);
    assertThat(body.getRowsValidated()).isEqualTo(1);
    assertThat(body.count(ErrorKind.CUSTOM)).isEqualTo(2);
  }

  @Test
  void missingFileIsStillASuccessfulResponse() {
    ValidationController controller = newController(ValidationService.standard());

    ResponseEntity<ValidationResult> response =
        controller.validate(request(tempDir.resolve("missing.csv").toString())).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody().count(ErrorKind.FILE)).isEqualTo(1);
  }

  @Test
  void badSchemaIsRejected() {
    ValidationController controller = newController(ValidationService.standard());
    ValidationRequest request = request("users.csv");
    request.getColumns().put("amount", new ColumnRuleRequest("money", null, null, null));

    assertThatThrownBy(() -> controller.validate(request).block())
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode().value()).isEqualTo(400));
  }

  @Test
  void unexpectedFailuresBecomeServerErrors() {
    ValidationService service = mock(ValidationService.class);
    when(service.validate(eq("users.csv"), any(), any())).thenThrow(new IllegalStateException("boom"));
    ValidationController controller = newController(service);

    ResponseEntity<ValidationResult> response = controller.validate(request("users.csv")).block();
    ResponseEntity<String> report = controller.report(request("users.csv"), true).block();

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(report.getStatusCode().value()).isEqualTo(500);
    assertThat(report.getBody()).isEqualTo("Unexpected error: boom");
  }

  @Test
  void reportUsesConfiguredVerbosityWhenNotRequested() {
    ValidationService service = mock(ValidationService.class);
    ValidationResult result = ValidationResult.builder()
        .filePath("users.csv")
        .errors(List.of(ValidationError.fileLevel(ErrorKind.FILE, "File is empty")))
        .build();
    when(service.validate(eq("users.csv"), any(), any())).thenReturn(result);
    properties.getReport().setVerbose(true);
    ValidationController controller = newController(service);

    ResponseEntity<String> response = controller.report(request("users.csv"), null).block();

    assertThat(response).isNotNull();
    assertThat(response.getBody())
        .contains("File Errors: 1")
        .contains("DETAILED ERRORS")
        .contains("Message: File is empty");
  }

  private ValidationController newController(ValidationService service) {
    return new ValidationController(service, mapper, new ValidationReportRenderer(properties), properties);
  }

  private static ValidationRequest request(String filePath) {
    LinkedHashMap<String, ColumnRuleRequest> columns = new LinkedHashMap<>();
    columns.put("id", new ColumnRuleRequest("Integer", true, null, null));
    columns.put("email", new ColumnRuleRequest("String", null, null, "email"));
    columns.put("balance", new ColumnRuleRequest("Float", null, true, "non-negative"));
    return new ValidationRequest().setFilePath(filePath).setColumns(columns);
  }
}
