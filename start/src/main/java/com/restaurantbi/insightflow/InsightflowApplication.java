package com.restaurantbi.insightflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Insightflow Application Entry Point
 *
 * @author insightflow
 */
@SpringBootApplication
public class InsightflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightflowApplication.class, args);
    }
}
