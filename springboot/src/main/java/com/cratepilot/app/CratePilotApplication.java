package com.cratepilot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CratePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CratePilotApplication.class, args);
    }
}
