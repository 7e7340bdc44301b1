package com.collabim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollabImApplication {
    public static void main(String[] args) {
        SpringApplication.run(CollabImApplication.class, args);
    }
}
