package com.ledgersync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgersyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgersyncApplication.class, args);
    }
}
