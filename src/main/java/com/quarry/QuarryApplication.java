package com.quarry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Quarry - deduplicating query dispatcher for log-search backends.
 */
@SpringBootApplication
public class QuarryApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuarryApplication.class, args);
    }
}
