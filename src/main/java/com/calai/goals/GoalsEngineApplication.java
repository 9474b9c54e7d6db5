package com.calai.goals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoalsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoalsEngineApplication.class, args);
    }
}
