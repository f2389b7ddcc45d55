package com.biospec.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BiospecServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiospecServerApplication.class, args);
    }
}
