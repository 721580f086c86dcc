package com.architecture.memory.palace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemoryPalaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryPalaceApplication.class, args);
    }
}
