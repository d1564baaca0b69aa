package com.resultpager.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.resultpager")
public class ResultPagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResultPagerApplication.class, args);
    }
}
