package com.feerouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeeRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeeRouterApplication.class, args);
    }
}
