package com.vidnyan.breakdown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Breakdown Engine - turns syntax trees into class, method and UI-hierarchy IR
 * for generated tests.
 */
@SpringBootApplication
public class BreakdownApplication {

    public static void main(String[] args) {
        SpringApplication.run(BreakdownApplication.class, args);
    }
}
