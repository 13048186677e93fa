package com.example.ficregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FicRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FicRegistryApplication.class, args);
    }
}
