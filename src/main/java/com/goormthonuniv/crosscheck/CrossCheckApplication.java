package com.goormthonuniv.crosscheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrossCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossCheckApplication.class, args);
    }
}
