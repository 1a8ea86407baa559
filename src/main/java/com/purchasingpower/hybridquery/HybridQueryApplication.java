package com.purchasingpower.hybridquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HybridQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridQueryApplication.class, args);
    }
}
