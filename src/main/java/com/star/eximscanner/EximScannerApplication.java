package com.star.eximscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EximScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EximScannerApplication.class, args);
    }
}
