package com.mobifone.updatecenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UpdateCenterApplication {
    public static void main(String[] args) {
        SpringApplication.run(UpdateCenterApplication.class, args);
    }
}
