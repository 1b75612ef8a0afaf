package com.whereq.arbiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Arbiter.
 * Hosts the analysis queue that admits and schedules long-running analysis jobs
 * over a fixed pool of workers.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ArbiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbiterApplication.class, args);
    }
}
