package com.team.qametrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QaMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(QaMetricsApplication.class, args);
    }
}
