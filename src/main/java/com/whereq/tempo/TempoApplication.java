package com.whereq.tempo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Tempo.
 * Admits long-running compute jobs (backtests, optimizations) through rate limiting,
 * jittered admission and a bounded queue, then runs them on a concurrency-limited worker pool.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class TempoApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempoApplication.class, args);
    }
}
