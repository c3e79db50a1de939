package com.demo.trends;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrendAggregatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrendAggregatorApplication.class, args);
    }
}
