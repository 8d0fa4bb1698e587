package com.blazesports.intel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlazeIntelCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlazeIntelCacheApplication.class, args);
    }
}
