package com.chaincheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChaincheckApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChaincheckApplication.class, args);
    }
}
