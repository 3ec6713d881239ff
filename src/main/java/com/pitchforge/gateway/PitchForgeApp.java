package com.pitchforge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.pitchforge")
public class PitchForgeApp {

    public static void main(String[] args) {
        SpringApplication.run(PitchForgeApp.class, args);
    }
}
