package com.sensor.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorAnomalyApplication.class, args);
    }
}
