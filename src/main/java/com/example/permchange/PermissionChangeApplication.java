package com.example.permchange;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PermissionChangeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PermissionChangeApplication.class, args);
    }
}
