package com.example.tracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SortTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SortTrackingApplication.class, args);
    }
}
