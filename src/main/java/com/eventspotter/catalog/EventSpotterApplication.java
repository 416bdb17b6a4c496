package com.eventspotter.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventSpotterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventSpotterApplication.class, args);
    }
}
