package com.formulatrace.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormulaTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaTraceApplication.class, args);
    }
}
