package com.pharmagraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PharmaGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(PharmaGraphApplication.class, args);
    }
}
