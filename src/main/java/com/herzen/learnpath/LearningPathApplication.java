package com.herzen.learnpath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearningPathApplication {
    public static void main(String[] args) {
        SpringApplication.run(LearningPathApplication.class, args);
    }
}
