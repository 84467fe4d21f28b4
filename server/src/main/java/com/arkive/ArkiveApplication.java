package com.arkive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArkiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArkiveApplication.class, args);
    }
}
