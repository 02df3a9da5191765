package com.stablecore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StableCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(StableCoreApplication.class, args);
    }
}
