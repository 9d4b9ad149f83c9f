package com.ai.salesagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAgentApplication.class, args);
    }
}
