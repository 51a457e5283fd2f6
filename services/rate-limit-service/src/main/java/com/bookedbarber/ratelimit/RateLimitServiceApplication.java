package com.bookedbarber.ratelimit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RateLimitServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RateLimitServiceApplication.class, args);
    }
}
