package com.civiclens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CivicLensSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CivicLensSyncApplication.class, args);
    }
}
