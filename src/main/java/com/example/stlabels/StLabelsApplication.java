package com.example.stlabels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StLabelsApplication {

    public static void main(String[] args) {
        SpringApplication.run(StLabelsApplication.class, args);
    }
}
