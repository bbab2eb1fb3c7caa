package com.example.datalake.csvguard.controller;

import com.example.datalake.csvguard.config.CsvValidationProperties;
import com.example.datalake.csvguard.model.CsvSchema;
import com.example.datalake.csvguard.model.ValidationOptions;
import com.example.datalake.csvguard.model.ValidationResult;
import com.example.datalake.csvguard.report.ValidationReportRenderer;
import com.example.datalake.csvguard.request.ValidationRequest;
import com.example.datalake.csvguard.service.ValidationRequestMapper;
import com.example.datalake.csvguard.validation.ValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@RestController
@RequestMapping("/api/v1/validations")
@RequiredArgsConstructor
@Tag(name = "CSV Validation", description = "Validate delimited files on the server against a column schema")
public class ValidationController {

    private final ValidationService validationService;
    private final ValidationRequestMapper requestMapper;
    private final ValidationReportRenderer reportRenderer;
    private final CsvValidationProperties properties;

    @PostMapping
    @Operation(
            summary = "Validate a file against a schema",
            description = "Runs the access, encoding, header and row checks and returns every violation found."
    )
    public Mono<ResponseEntity<ValidationResult>> validate(@Valid @RequestBody ValidationRequest request) {
        return run(request)
                .map(ResponseEntity::ok)
                .onErrorResume(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("Unexpected failure while validating {}", request.getFilePath(), ex);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
                });
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Validate a file and return the plain text report")
    public Mono<ResponseEntity<String>> report(
            @Valid @RequestBody ValidationRequest request,
            @RequestParam(required = false) Boolean verbose) {
        boolean detailed = verbose != null ? verbose : properties.getReport().isVerbose();
        return run(request)
                .map(result -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_PLAIN)
                        .body(reportRenderer.render(result, detailed)))
                .onErrorResume(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("Unexpected failure while rendering report for {}", request.getFilePath(), ex);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .contentType(MediaType.TEXT_PLAIN)
                            .body("Unexpected error: " + ex.getMessage()));
                });
    }

    private Mono<ValidationResult> run(ValidationRequest request) {
        if (request.getFilePath() == null || request.getFilePath().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "filePath must not be blank"));
        }
        CsvSchema schema;
        ValidationOptions options;
        try {
            schema = requestMapper.toSchema(request);
            options = requestMapper.toOptions(request);
        } catch (ResponseStatusException ex) {
            return Mono.error(ex);
        }
        // file reads block
        return Mono.fromCallable(() -> validationService.validate(request.getFilePath(), schema, options))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
