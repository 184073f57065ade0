package com.example.sclanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SclAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SclAnalyzerApplication.class, args);
    }
}
