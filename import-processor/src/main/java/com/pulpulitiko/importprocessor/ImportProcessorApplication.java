package com.pulpulitiko.importprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImportProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImportProcessorApplication.class, args);
    }
}
