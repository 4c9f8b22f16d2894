package com.optionlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionLabApplication.class, args);
    }
}
