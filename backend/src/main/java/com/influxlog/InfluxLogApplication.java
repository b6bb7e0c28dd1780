package com.influxlog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfluxLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfluxLogApplication.class, args);
    }
}
