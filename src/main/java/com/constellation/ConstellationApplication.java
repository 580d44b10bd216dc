package com.constellation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConstellationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConstellationApplication.class, args);
    }
}
