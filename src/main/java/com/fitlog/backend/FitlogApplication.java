package com.fitlog.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FitlogApplication {

    public static void main(String[] args) {
        SpringApplication.run(FitlogApplication.class, args);
    }
}
