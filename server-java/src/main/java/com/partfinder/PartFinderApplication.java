package com.partfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PartFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartFinderApplication.class, args);
    }
}
