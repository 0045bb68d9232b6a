package com.dailyfit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DailyFitApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyFitApplication.class, args);
    }
}
