package com.lunchtable.progression;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProgressionApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProgressionApplication.class, args);
    }
}
