package com.examparse.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.examparse")
public class ExamParseApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamParseApiApplication.class, args);
    }
}
