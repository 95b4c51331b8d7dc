package com.event.seating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeatingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeatingApplication.class, args);
    }
}
