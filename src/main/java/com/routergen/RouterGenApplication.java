package com.routergen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RouterGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouterGenApplication.class, args);
    }
}
