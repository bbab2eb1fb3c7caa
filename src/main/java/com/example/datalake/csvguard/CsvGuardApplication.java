package com.example.datalake.csvguard;

import com.example.datalake.csvguard.config.CsvValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CsvValidationProperties.class)
public class CsvGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CsvGuardApplication.class, args);
    }

}
