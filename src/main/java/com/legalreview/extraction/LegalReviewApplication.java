package com.legalreview.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LegalReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalReviewApplication.class, args);
    }
}
