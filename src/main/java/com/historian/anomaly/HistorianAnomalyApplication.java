package com.historian.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HistorianAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(HistorianAnomalyApplication.class, args);
    }
}
