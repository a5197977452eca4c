package com.faceregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaceRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceRegistryApplication.class, args);
    }
}
