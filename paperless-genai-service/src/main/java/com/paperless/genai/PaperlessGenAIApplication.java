package com.paperless.genai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.paperless.genai", "com.paperless.common"})
public class PaperlessGenAIApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperlessGenAIApplication.class, args);
    }

}
