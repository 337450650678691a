package com.pingpay.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Job scheduler service.
 *
 * To run against a local Postgres:
 *   DATABASE_URL=jdbc:postgresql://localhost:5432/scheduler mvn -pl scheduler spring-boot:run
 */
@SpringBootApplication
public class SchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulerApplication.class, args);
    }
}
