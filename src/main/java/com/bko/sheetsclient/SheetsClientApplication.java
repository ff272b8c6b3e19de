package com.bko.sheetsclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetsClientApplication {
    public static void main(String[] args) {
        SpringApplication.run(SheetsClientApplication.class, args);
    }
}
