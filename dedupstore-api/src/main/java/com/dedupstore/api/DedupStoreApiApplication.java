package com.dedupstore.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.dedupstore")
public class DedupStoreApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(DedupStoreApiApplication.class, args);
    }
}
