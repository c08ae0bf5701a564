package com.example.intel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioIntelApplication.class, args);
    }

}
