package com.trialstruct;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrialStructApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrialStructApplication.class, args);
    }
}
