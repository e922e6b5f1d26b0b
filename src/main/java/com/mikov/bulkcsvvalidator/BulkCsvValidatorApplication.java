package com.mikov.bulkcsvvalidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the bulk CSV email validation service.
 *
 * @author zahari.mikov
 */
@SpringBootApplication
public class BulkCsvValidatorApplication {

    public static void main(final String[] args) {
        SpringApplication.run(BulkCsvValidatorApplication.class, args);
    }
}
