package com.architecture.memory.diagrammer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiagrammerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiagrammerApplication.class, args);
    }
}
