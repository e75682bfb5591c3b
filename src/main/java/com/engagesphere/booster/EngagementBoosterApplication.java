package com.engagesphere.booster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EngagementBoosterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngagementBoosterApplication.class, args);
    }
}
