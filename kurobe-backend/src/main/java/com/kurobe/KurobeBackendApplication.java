package com.kurobe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KurobeBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(KurobeBackendApplication.class, args);
    }
}
