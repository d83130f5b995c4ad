package com.draftflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Draftflow Application Entry Point
 *
 * @author draftflow
 */
@SpringBootApplication(scanBasePackages = "com.draftflow")
public class DraftflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DraftflowApplication.class, args);
    }
}
