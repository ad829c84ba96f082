package com.spendradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpendRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpendRadarApplication.class, args);
    }
}
