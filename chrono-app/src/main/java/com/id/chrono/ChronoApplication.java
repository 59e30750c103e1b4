package com.id.chrono;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChronoApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChronoApplication.class, args);
    }

}
