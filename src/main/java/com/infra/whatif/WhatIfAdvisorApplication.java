package com.infra.whatif;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WhatIfAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhatIfAdvisorApplication.class, args);
    }
}
