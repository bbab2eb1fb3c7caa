package com.example.datalake.csvguard.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "CsvGuard API",
        version = "v1",
        description = "Schema driven validation of delimited text files.",
        contact = @Contact(name = "Data Lake Team", email = "support@csvguard.local")
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("CsvGuard API")
            .version("v1")
            .description("Validate CSV files against declarative column schemas and render reports.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi validationApi() {
    return GroupedOpenApi.builder()
        .group("validation")
        .packagesToScan("com.example.datalake.csvguard.controller")
        .pathsToMatch("/api/v1/**", "/health")
        .build();
  }
}
