package com.offy.competition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompetitionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompetitionEngineApplication.class, args);
    }
}
