package com.csvslicer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CsvSlicerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CsvSlicerApplication.class, args)));
    }
}
