package com.ruleflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RuleflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuleflowApplication.class, args);
    }
}
