package com.example.guardshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuardShiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardShiftApplication.class, args);
    }
}
