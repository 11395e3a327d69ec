package com.eainde.legalqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalQaApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalQaApplication.class, args);
    }
}
