package com.wpanther.ocppcentral;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OcppCentralSystemApplication {

    public static void main(String[] args) {
        SpringApplication.run(OcppCentralSystemApplication.class, args);
    }
}
