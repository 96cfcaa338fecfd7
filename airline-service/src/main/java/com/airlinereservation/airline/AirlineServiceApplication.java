package com.airlinereservation.airline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AirlineServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AirlineServiceApplication.class, args);
    }
}
