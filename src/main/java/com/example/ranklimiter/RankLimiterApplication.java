package com.example.ranklimiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Application Main Class
 */
@SpringBootApplication
public class RankLimiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankLimiterApplication.class, args);
    }
}
