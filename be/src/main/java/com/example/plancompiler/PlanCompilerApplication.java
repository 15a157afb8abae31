package com.example.plancompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlanCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanCompilerApplication.class, args);
    }
}
