package com.mcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MCacheApplication.class, args);
    }
}
