package com.example.acgarden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AcGardenApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AcGardenApplication.class, args)));
    }
}
