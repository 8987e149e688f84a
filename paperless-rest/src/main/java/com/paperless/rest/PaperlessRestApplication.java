package com.paperless.rest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.paperless.rest", "com.paperless.common"})
public class PaperlessRestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperlessRestApplication.class, args);
    }

}
